package com.controlactas.service.reference;

import com.controlactas.model.OperatingMode;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * Substring match against a short keyword table. The unit is ignored.
 * <p>
 * Keywords are scanned longest first and the first one contained in the description wins,
 * so "estabilizacion con rajon" beats a shorter generic keyword. With wordBoundary set,
 * a keyword must start and end on a word boundary of the normalized description.
 */
public final class KeywordModeResolver implements ReferenceResolver {

    private final KeywordPriceTable table;
    private final boolean wordBoundary;

    public KeywordModeResolver(KeywordPriceTable table, boolean wordBoundary) {
        this.table = table;
        this.wordBoundary = wordBoundary;
    }

    @Override
    public OperatingMode mode() {
        return OperatingMode.CRITICAL;
    }

    @Override
    public Optional<BigDecimal> lookup(String normalizedDescription, String normalizedUnit) {
        return matchKeyword(normalizedDescription).map(Map.Entry::getValue);
    }

    /**
     * The winning keyword and its price, if any.
     */
    public Optional<Map.Entry<String, BigDecimal>> matchKeyword(String normalizedDescription) {
        if (normalizedDescription == null || normalizedDescription.isEmpty()) {
            return Optional.empty();
        }
        for (Map.Entry<String, BigDecimal> entry : table.entriesLongestFirst()) {
            if (matches(normalizedDescription, entry.getKey())) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    private boolean matches(String description, String keyword) {
        if (!wordBoundary) {
            return description.contains(keyword);
        }
        // normalized text only separates words with single spaces
        return (" " + description + " ").contains(" " + keyword + " ");
    }

    @Override
    public int size() {
        return table.size();
    }
}
