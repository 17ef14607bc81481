package com.controlactas.service.text;

import com.controlactas.model.Category;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Assigns a line item to a quantity family by keyword.
 * Rules are evaluated in a fixed order and the first match wins.
 */
public final class ActivityClassifier {

    private static final Pattern MR_WORD = Pattern.compile("\\bmr\\b");

    private ActivityClassifier() {}

    /**
     * @param normalizedDescription output of {@link TextNormalizer#normalizeText(String)}
     */
    public static Optional<Category> classify(String normalizedDescription) {
        if (normalizedDescription == null || normalizedDescription.isEmpty()) {
            return Optional.empty();
        }
        String d = normalizedDescription.toLowerCase(Locale.ROOT);

        if (d.contains("estamp")) {
            return Optional.of(Category.CONCRETE_STAMPED);
        }
        if (MR_WORD.matcher(d).find()) {
            return Optional.of(Category.CONCRETE_MR);
        }
        if (d.contains("excav")) {
            return Optional.of(Category.EXCAVATION);
        }
        if (d.contains("rellen")) {
            return Optional.of(Category.BACKFILL);
        }
        return Optional.empty();
    }
}
