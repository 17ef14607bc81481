package com.controlactas.service.output;

import com.controlactas.model.Category;
import com.controlactas.model.CategoryTotals;
import com.controlactas.model.ReconciliationRecord;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Column layout shared by the ledger and the summary workbooks, so the ledger written
 * by one run can be read back by the next.
 */
public final class RegisterLayout {

    public static final String REGISTER_SHEET = "REGISTRO";
    public static final String QUANTITIES_SHEET = "CANTIDADES";
    public static final String SUMMARY_SHEET = "RESUMEN";

    public static final String YEAR = "anio";
    public static final String MONTH = "mes";
    public static final String FILE = "archivo";
    public static final String CONTRACTOR = "contratista";
    public static final String ITEM = "item";
    public static final String DESCRIPTION = "descripcion";
    public static final String UNIT = "un";
    public static final String PAID_UNIT_PRICE = "valor_unitario_pagado";
    public static final String AGREED_UNIT_PRICE = "valor_pactado";
    public static final String QUANTITY = "cantidad_presenta";
    public static final String PAID_VALUE = "valor_pagado";
    public static final String ADJUSTED_VALUE = "valor_ajustado";
    public static final String DISCOUNT = "descuento";
    public static final String MODE = "modo";

    public static final List<String> REGISTER_HEADERS = List.of(
            YEAR, MONTH, FILE, CONTRACTOR, ITEM, DESCRIPTION, UNIT,
            PAID_UNIT_PRICE, AGREED_UNIT_PRICE, QUANTITY, PAID_VALUE, ADJUSTED_VALUE, DISCOUNT, MODE);

    private RegisterLayout() {}

    public static List<Object> registerRow(ReconciliationRecord r) {
        return Arrays.asList(
                r.year(), r.month(), r.sourceFile(), r.contractor(), r.itemCode(), r.description(), r.unit(),
                r.declaredUnitPrice(), r.referenceUnitPrice(), r.quantity(), r.paidValue(), r.adjustedValue(),
                r.discount(), r.mode().name());
    }

    public static List<String> quantityHeaders() {
        List<String> headers = new ArrayList<>(List.of(YEAR, MONTH, FILE, CONTRACTOR));
        for (Category category : Category.values()) {
            headers.add(category.label());
        }
        headers.add(MODE);
        return headers;
    }

    public static List<Object> quantityRow(CategoryTotals t) {
        List<Object> row = new ArrayList<>(Arrays.asList(t.year(), t.month(), t.sourceFile(), t.contractor()));
        for (Category category : Category.values()) {
            row.add(t.quantity(category));
        }
        row.add(t.mode().name());
        return row;
    }
}
