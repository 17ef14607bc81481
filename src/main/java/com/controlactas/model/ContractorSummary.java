package com.controlactas.model;

import java.math.BigDecimal;

/**
 * Flagged items per contractor within one period.
 */
public record ContractorSummary(
    String contractor,
    long flaggedItems,
    BigDecimal adjustedValueSum
) {}
