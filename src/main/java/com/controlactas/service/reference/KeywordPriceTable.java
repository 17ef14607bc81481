package com.controlactas.service.reference;

import com.controlactas.service.text.TextNormalizer;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Critical activities: keyword to fixed reference price.
 * Keywords are normalized on construction and kept sorted by length, longest first;
 * equal lengths keep their configured order.
 */
public final class KeywordPriceTable {

    private final List<Map.Entry<String, BigDecimal>> entries;

    private KeywordPriceTable(List<Map.Entry<String, BigDecimal>> entries) {
        this.entries = List.copyOf(entries);
    }

    public static KeywordPriceTable of(Map<String, BigDecimal> keywords) {
        Map<String, BigDecimal> normalized = new LinkedHashMap<>();
        if (keywords != null) {
            keywords.forEach((keyword, price) -> {
                String key = TextNormalizer.normalizeText(keyword);
                if (key != null && !key.isEmpty() && price != null) {
                    normalized.put(key, price);
                }
            });
        }
        List<Map.Entry<String, BigDecimal>> sorted = new ArrayList<>();
        normalized.forEach((k, v) -> sorted.add(Map.entry(k, v)));
        // List.sort is stable
        sorted.sort(Comparator.comparingInt((Map.Entry<String, BigDecimal> e) -> e.getKey().length()).reversed());
        return new KeywordPriceTable(sorted);
    }

    public List<Map.Entry<String, BigDecimal>> entriesLongestFirst() {
        return entries;
    }

    public int size() {
        return entries.size();
    }
}
