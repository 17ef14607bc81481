package com.controlactas.service.aggregation;

import com.controlactas.model.Category;
import com.controlactas.model.CategoryTotals;
import com.controlactas.model.ContractorCategorySummary;
import com.controlactas.model.ContractorSummary;
import com.controlactas.model.Period;
import com.controlactas.model.PeriodContractorSummary;
import com.controlactas.model.PeriodScoped;
import com.controlactas.model.ReconciliationRecord;
import com.controlactas.service.period.PeriodParser;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Folds per-certificate results into contractor level summaries. Pure functions only;
 * summaries are always recomputed from the records, never stored on their own.
 */
@Component
public class ReconciliationAggregator {

    /**
     * Flagged item count and adjusted value sum per contractor, sorted by contractor.
     */
    public List<ContractorSummary> summarizeByContractor(List<ReconciliationRecord> records) {
        Map<String, long[]> counts = new TreeMap<>();
        Map<String, BigDecimal> sums = new TreeMap<>();
        for (ReconciliationRecord record : records) {
            counts.computeIfAbsent(record.contractor(), k -> new long[1])[0]++;
            sums.merge(record.contractor(), record.adjustedValue(), BigDecimal::add);
        }
        List<ContractorSummary> summaries = new ArrayList<>();
        counts.forEach((contractor, count) ->
                summaries.add(new ContractorSummary(contractor, count[0], sums.get(contractor))));
        return summaries;
    }

    /**
     * Category quantities summed per contractor, sorted by contractor.
     */
    public List<ContractorCategorySummary> summarizeCategories(List<CategoryTotals> totals) {
        Map<String, EnumMap<Category, BigDecimal>> byContractor = new TreeMap<>();
        for (CategoryTotals certificate : totals) {
            EnumMap<Category, BigDecimal> sum = byContractor.computeIfAbsent(
                    certificate.contractor(), k -> CategoryTotals.emptyQuantities());
            certificate.quantities().forEach((category, quantity) -> sum.merge(category, quantity, BigDecimal::add));
        }
        List<ContractorCategorySummary> summaries = new ArrayList<>();
        byContractor.forEach((contractor, sum) ->
                summaries.add(new ContractorCategorySummary(contractor, Collections.unmodifiableMap(sum))));
        return summaries;
    }

    /**
     * Per (year, month, contractor) across the whole ledger, oldest period first.
     */
    public List<PeriodContractorSummary> summarizeGlobal(List<ReconciliationRecord> records) {
        Map<GlobalKey, List<ReconciliationRecord>> groups = new TreeMap<>(GlobalKey.ORDER);
        for (ReconciliationRecord record : records) {
            groups.computeIfAbsent(new GlobalKey(record.year(), record.month(), record.contractor()),
                    k -> new ArrayList<>()).add(record);
        }
        List<PeriodContractorSummary> summaries = new ArrayList<>();
        groups.forEach((key, group) -> summaries.add(new PeriodContractorSummary(
                key.year(), key.month(), key.contractor(), group.size(),
                group.stream().map(ReconciliationRecord::adjustedValue).reduce(BigDecimal.ZERO, BigDecimal::add))));
        return summaries;
    }

    /**
     * Drops every row of the period from existing and appends the replacement rows.
     * Running it twice with the same replacement gives the same ledger.
     */
    public <T extends PeriodScoped> List<T> replacePeriod(List<T> existing, Period period, List<T> replacement) {
        List<T> merged = new ArrayList<>(existing.size() + replacement.size());
        for (T row : existing) {
            if (!row.belongsTo(period)) {
                merged.add(row);
            }
        }
        merged.addAll(replacement);
        return merged;
    }

    private record GlobalKey(int year, String month, String contractor) {
        static final Comparator<GlobalKey> ORDER = Comparator.comparingInt(GlobalKey::year)
                .thenComparingInt(k -> PeriodParser.monthNumber(k.month()))
                .thenComparing(GlobalKey::month)
                .thenComparing(GlobalKey::contractor);
    }
}
