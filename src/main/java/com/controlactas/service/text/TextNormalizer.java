package com.controlactas.service.text;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Canonical forms of descriptions and unit labels used as lookup keys.
 */
public final class TextNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9 ]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Map<String, String> UNIT_SYNONYMS = Map.of(
            "UND", "UN",
            "UNID", "UN",
            "UNIDAD", "UN",
            "U", "UN",
            "ML", "M",
            "M.L", "M"
    );

    private TextNormalizer() {}

    /**
     * Lower-cases, strips accents, replaces anything outside [a-z0-9 ] with a space
     * and collapses whitespace. Null stays null.
     */
    public static String normalizeText(String text) {
        if (text == null) {
            return null;
        }
        String s = text.toLowerCase(Locale.ROOT);
        s = COMBINING_MARKS.matcher(Normalizer.normalize(s, Normalizer.Form.NFD)).replaceAll("");
        s = NON_ALPHANUMERIC.matcher(s).replaceAll(" ");
        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }

    /**
     * Upper-cases a unit label and maps known variants onto one spelling.
     * Never fails; unknown units pass through.
     */
    public static String normalizeUnit(String unit) {
        if (unit == null) {
            return "";
        }
        String s = unit.trim().toUpperCase(Locale.ROOT)
                .replace("M³", "M3").replace("M^3", "M3")
                .replace("M²", "M2").replace("M^2", "M2");
        s = WHITESPACE.matcher(s).replaceAll("");
        return UNIT_SYNONYMS.getOrDefault(s, s);
    }

    /**
     * Accent-insensitive upper-case form used to compare spreadsheet headers.
     */
    public static String normalizeHeader(String header) {
        if (header == null) {
            return "";
        }
        String s = COMBINING_MARKS.matcher(Normalizer.normalize(header, Normalizer.Form.NFD)).replaceAll("");
        return WHITESPACE.matcher(s.toUpperCase(Locale.ROOT)).replaceAll(" ").trim();
    }
}
