package com.controlactas.service.period;

import com.controlactas.model.Period;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives (year, month) from month folder names such as "julio2025" or "actas_jul2024".
 */
public final class PeriodParser {

    private static final Pattern YEAR = Pattern.compile("(\\d{4})");

    // full names before their abbreviations; first contained token wins
    private static final Map<String, Integer> MONTH_TOKENS = new LinkedHashMap<>();
    private static final String[] MONTH_NAMES = {
            "enero", "febrero", "marzo", "abril", "mayo", "junio",
            "julio", "agosto", "septiembre", "octubre", "noviembre", "diciembre"
    };

    static {
        String[][] tokens = {
                {"enero", "ene"}, {"febrero", "feb"}, {"marzo", "mar"}, {"abril", "abr"},
                {"mayo", "may"}, {"junio", "jun"}, {"julio", "jul"}, {"agosto", "ago"},
                {"septiembre", "setiembre", "sep"}, {"octubre", "oct"}, {"noviembre", "nov"},
                {"diciembre", "dic"}
        };
        for (int i = 0; i < tokens.length; i++) {
            for (String token : tokens[i]) {
                MONTH_TOKENS.put(token, i + 1);
            }
        }
    }

    private PeriodParser() {}

    public static Optional<Period> parse(String folderName) {
        if (folderName == null) {
            return Optional.empty();
        }
        String name = folderName.toLowerCase(Locale.ROOT);

        Matcher matcher = YEAR.matcher(name);
        if (!matcher.find()) {
            return Optional.empty();
        }
        int year = Integer.parseInt(matcher.group(1));

        for (Map.Entry<String, Integer> token : MONTH_TOKENS.entrySet()) {
            if (name.contains(token.getKey())) {
                return Optional.of(new Period(year, MONTH_NAMES[token.getValue() - 1], folderName));
            }
        }
        return Optional.empty();
    }

    /**
     * 1..12 for a canonical month name or abbreviation, 0 when unknown.
     */
    public static int monthNumber(String month) {
        if (month == null) {
            return 0;
        }
        return MONTH_TOKENS.getOrDefault(month.toLowerCase(Locale.ROOT), 0);
    }
}
