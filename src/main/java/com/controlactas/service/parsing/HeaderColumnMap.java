package com.controlactas.service.parsing;

import com.controlactas.service.text.TextNormalizer;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Column names of a certificate sheet, built from its two header rows.
 * Per column the two header cells are joined with a space when both are filled,
 * otherwise whichever is filled is used. Names are compared without accents,
 * so "ÍTEM" and "ITEM" are the same column.
 */
public final class HeaderColumnMap {

    private final Map<String, Integer> columns;

    private HeaderColumnMap(Map<String, Integer> columns) {
        this.columns = Collections.unmodifiableMap(columns);
    }

    public static HeaderColumnMap read(Sheet sheet, int firstHeaderRow, int secondHeaderRow) {
        Row first = sheet.getRow(firstHeaderRow);
        Row second = sheet.getRow(secondHeaderRow);
        int width = Math.max(lastCell(first), lastCell(second));

        Map<String, Integer> columns = new LinkedHashMap<>();
        for (int col = 0; col < width; col++) {
            String top = CellValues.text(first == null ? null : first.getCell(col));
            String bottom = CellValues.text(second == null ? null : second.getCell(col));
            String name;
            if (!top.isEmpty() && !bottom.isEmpty()) {
                name = top + " " + bottom;
            } else if (!top.isEmpty()) {
                name = top;
            } else {
                name = bottom;
            }
            String key = TextNormalizer.normalizeHeader(name);
            if (!key.isEmpty()) {
                columns.put(key, col);
            }
        }
        return new HeaderColumnMap(columns);
    }

    private static int lastCell(Row row) {
        return row == null ? 0 : Math.max(0, row.getLastCellNum());
    }

    public Optional<Integer> find(String name) {
        return Optional.ofNullable(columns.get(TextNormalizer.normalizeHeader(name)));
    }

    public int columnOr(String name, int fallback) {
        return find(name).orElse(fallback);
    }

    /**
     * Exact header first, otherwise the first header containing the fragment.
     */
    public Optional<Integer> findContaining(String fragment) {
        Optional<Integer> exact = find(fragment);
        if (exact.isPresent()) {
            return exact;
        }
        String key = TextNormalizer.normalizeHeader(fragment);
        return columns.entrySet().stream()
                .filter(e -> e.getKey().contains(key))
                .map(Map.Entry::getValue)
                .findFirst();
    }
}
