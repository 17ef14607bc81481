package com.controlactas.model;

import java.math.BigDecimal;

/**
 * A flagged line item: declared unit price deviates from the reference by more than the tolerance.
 */
public record ReconciliationRecord(
    int year,
    String month,
    String sourceFile,
    String contractor,
    String itemCode,
    String description,
    String unit,
    BigDecimal declaredUnitPrice,
    BigDecimal referenceUnitPrice,
    BigDecimal quantity,
    BigDecimal adjustedValue,
    OperatingMode mode
) implements PeriodScoped {

    public Deviation deviation() {
        return Deviation.of(declaredUnitPrice.subtract(referenceUnitPrice));
    }

    /**
     * Amount billed by the contractor for this row.
     */
    public BigDecimal paidValue() {
        return declaredUnitPrice.multiply(quantity);
    }

    public BigDecimal discount() {
        return paidValue().subtract(adjustedValue);
    }
}
