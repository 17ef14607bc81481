package com.controlactas.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything produced by one period run.
 */
public record PeriodResult(
    Period period,
    OperatingMode mode,
    List<ReconciliationRecord> records,
    List<CategoryTotals> categoryTotals,
    List<ContractorSummary> contractorSummaries,
    List<ContractorCategorySummary> categorySummaries,
    List<Path> artifacts,
    RunReport report
) {}
