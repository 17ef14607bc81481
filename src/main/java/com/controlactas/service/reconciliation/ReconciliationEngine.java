package com.controlactas.service.reconciliation;

import com.controlactas.model.Category;
import com.controlactas.model.CategoryTotals;
import com.controlactas.model.CellAnnotation;
import com.controlactas.model.Deviation;
import com.controlactas.model.LineItem;
import com.controlactas.model.Period;
import com.controlactas.model.ReconciliationRecord;
import com.controlactas.service.parsing.ParsedCertificate;
import com.controlactas.service.parsing.QuantityRow;
import com.controlactas.service.reference.ReferenceResolver;
import com.controlactas.service.text.ActivityClassifier;
import com.controlactas.service.text.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compares each line item of a certificate with its reference price.
 *
 * Per item: classify into a quantity family, look up the reference, then
 * NO_REFERENCE, WITHIN_TOLERANCE or FLAGGED. Only FLAGGED items produce a record;
 * every classified item adds its quantity to the certificate's category totals.
 * The per-family quantity lists come from the parser's unfiltered quantity rows.
 */
@Component
@Slf4j
public class ReconciliationEngine {

    /**
     * Absolute tolerance in currency units. A difference of exactly 1 is not flagged.
     */
    public static final BigDecimal TOLERANCE = BigDecimal.ONE;

    public LineItemEvaluation evaluate(LineItem item, ReferenceResolver resolver) {
        String description = TextNormalizer.normalizeText(item.description());
        String unit = TextNormalizer.normalizeUnit(item.unit());
        Category category = ActivityClassifier.classify(description).orElse(null);

        Optional<BigDecimal> reference = resolver.lookup(description, unit);
        if (reference.isEmpty()) {
            return new LineItemEvaluation(item, category, unit, LineItemOutcome.NO_REFERENCE, null, null);
        }

        BigDecimal difference = item.declaredUnitPrice().subtract(reference.get());
        LineItemOutcome outcome = difference.abs().compareTo(TOLERANCE) > 0
                ? LineItemOutcome.FLAGGED
                : LineItemOutcome.WITHIN_TOLERANCE;
        return new LineItemEvaluation(item, category, unit, outcome, reference.get(), difference);
    }

    public CertificateReconciliation reconcile(Period period, ParsedCertificate certificate, ReferenceResolver resolver) {
        List<ReconciliationRecord> records = new ArrayList<>();
        List<CellAnnotation> annotations = new ArrayList<>();
        EnumMap<Category, BigDecimal> totals = CategoryTotals.emptyQuantities();
        EnumMap<Category, List<BigDecimal>> quantities = new EnumMap<>(Category.class);
        EnumMap<LineItemOutcome, Integer> counts = new EnumMap<>(LineItemOutcome.class);
        for (Category category : Category.values()) {
            quantities.put(category, new ArrayList<>());
        }
        for (LineItemOutcome outcome : LineItemOutcome.values()) {
            counts.put(outcome, 0);
        }

        for (LineItem item : certificate.items()) {
            LineItemEvaluation evaluation = evaluate(item, resolver);
            counts.merge(evaluation.outcome(), 1, Integer::sum);

            if (evaluation.category() != null) {
                totals.merge(evaluation.category(), item.quantity(), BigDecimal::add);
            }

            if (evaluation.isFlagged()) {
                records.add(toRecord(period, certificate, evaluation, resolver));
                annotations.add(new CellAnnotation(item.rowIndex(), certificate.priceColumn(),
                        Deviation.of(evaluation.difference())));
            }
        }

        for (QuantityRow row : certificate.quantityRows()) {
            ActivityClassifier.classify(TextNormalizer.normalizeText(row.description()))
                    .ifPresent(category -> quantities.get(category).add(row.quantity()));
        }

        log.debug("Reconciled {}: {} items, outcomes={}, totals={}",
                certificate.sourceFile(), certificate.items().size(), counts, totals);

        Map<Category, List<BigDecimal>> frozen = new EnumMap<>(Category.class);
        quantities.forEach((category, list) -> frozen.put(category, List.copyOf(list)));

        CategoryTotals categoryTotals = new CategoryTotals(period.year(), period.month(),
                certificate.sourceFile(), certificate.contractor(), totals, resolver.mode());
        return new CertificateReconciliation(List.copyOf(records), categoryTotals, List.copyOf(annotations),
                Collections.unmodifiableMap(frozen), Collections.unmodifiableMap(counts));
    }

    private static ReconciliationRecord toRecord(Period period, ParsedCertificate certificate,
                                                 LineItemEvaluation evaluation, ReferenceResolver resolver) {
        LineItem item = evaluation.item();
        return new ReconciliationRecord(
                period.year(),
                period.month(),
                certificate.sourceFile(),
                certificate.contractor(),
                item.itemCode(),
                item.description(),
                evaluation.normalizedUnit(),
                item.declaredUnitPrice(),
                evaluation.reference(),
                item.quantity(),
                evaluation.adjustedValue(),
                resolver.mode()
        );
    }
}
