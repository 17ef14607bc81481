package com.controlactas.model;

import java.math.BigDecimal;
import java.util.Map;

public record ContractorCategorySummary(
    String contractor,
    Map<Category, BigDecimal> quantities
) {}
