package com.controlactas.service.reconciliation;

import com.controlactas.model.Category;
import com.controlactas.model.CategoryTotals;
import com.controlactas.model.CellAnnotation;
import com.controlactas.model.ReconciliationRecord;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Output of reconciling one certificate. Nothing here has been written anywhere yet.
 *
 * @param annotations        cells to colour in the verified copy
 * @param categoryQuantities individual quantities per family, in sheet order
 */
public record CertificateReconciliation(
    List<ReconciliationRecord> records,
    CategoryTotals categoryTotals,
    List<CellAnnotation> annotations,
    Map<Category, List<BigDecimal>> categoryQuantities,
    Map<LineItemOutcome, Integer> outcomeCounts
) {}
