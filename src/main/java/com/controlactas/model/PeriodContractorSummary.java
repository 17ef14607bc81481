package com.controlactas.model;

import java.math.BigDecimal;

/**
 * Row of the global summary across all periods.
 */
public record PeriodContractorSummary(
    int year,
    String month,
    String contractor,
    long flaggedItems,
    BigDecimal adjustedValueSum
) {}
