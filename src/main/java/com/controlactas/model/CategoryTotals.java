package com.controlactas.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Quantities per category for one certificate.
 */
public record CategoryTotals(
    int year,
    String month,
    String sourceFile,
    String contractor,
    Map<Category, BigDecimal> quantities,
    OperatingMode mode
) implements PeriodScoped {

    public CategoryTotals {
        EnumMap<Category, BigDecimal> copy = emptyQuantities();
        if (quantities != null) {
            copy.putAll(quantities);
        }
        quantities = Collections.unmodifiableMap(copy);
    }

    public BigDecimal quantity(Category category) {
        return quantities.get(category);
    }

    /**
     * All four categories initialised to zero.
     */
    public static EnumMap<Category, BigDecimal> emptyQuantities() {
        EnumMap<Category, BigDecimal> map = new EnumMap<>(Category.class);
        for (Category category : Category.values()) {
            map.put(category, BigDecimal.ZERO);
        }
        return map;
    }
}
