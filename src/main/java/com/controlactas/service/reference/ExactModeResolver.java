package com.controlactas.service.reference;

import com.controlactas.model.OperatingMode;
import com.controlactas.model.PriceReferenceEntry;
import com.controlactas.service.text.TextNormalizer;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Direct hash lookup on (normalized description, normalized unit).
 * No fuzzy fallback: a single differing character means no match.
 */
@Slf4j
public final class ExactModeResolver implements ReferenceResolver {

    private final Map<PriceKey, BigDecimal> prices;

    private ExactModeResolver(Map<PriceKey, BigDecimal> prices) {
        this.prices = Map.copyOf(prices);
    }

    /**
     * Builds the snapshot from store rows. Rows without a unit or without a usable
     * description are ignored; when two rows normalize to the same key the later one wins,
     * so callers pass entries ordered by update time.
     */
    public static ExactModeResolver fromEntries(List<PriceReferenceEntry> entries) {
        Map<PriceKey, BigDecimal> prices = new HashMap<>();
        int ignored = 0;
        for (PriceReferenceEntry entry : entries) {
            String description = TextNormalizer.normalizeText(entry.activity());
            String unit = TextNormalizer.normalizeUnit(entry.unit());
            if (description == null || description.isEmpty() || unit.isEmpty() || entry.price() == null) {
                ignored++;
                continue;
            }
            prices.put(new PriceKey(description, unit), entry.price());
        }
        log.info("Exact-mode snapshot built: {} keys from {} rows ({} ignored)",
                prices.size(), entries.size(), ignored);
        return new ExactModeResolver(prices);
    }

    @Override
    public OperatingMode mode() {
        return OperatingMode.NORMAL;
    }

    @Override
    public Optional<BigDecimal> lookup(String normalizedDescription, String normalizedUnit) {
        if (normalizedDescription == null || normalizedUnit == null || normalizedUnit.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(prices.get(new PriceKey(normalizedDescription, normalizedUnit)));
    }

    @Override
    public int size() {
        return prices.size();
    }
}
