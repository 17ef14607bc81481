package com.controlactas.service.reference;

import com.controlactas.model.OperatingMode;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class KeywordModeResolverTest {

    private static KeywordPriceTable table() {
        Map<String, BigDecimal> keywords = new LinkedHashMap<>();
        keywords.put("BASE", new BigDecimal("800"));
        keywords.put("BASE GRANULAR", new BigDecimal("1000"));
        keywords.put("Estabilización con RCD", new BigDecimal("4500"));
        keywords.put("   ", new BigDecimal("1"));
        return KeywordPriceTable.of(keywords);
    }

    @Test
    void table_dropsBlankKeywordsAndSortsLongestFirst() {
        KeywordPriceTable table = table();

        assertEquals(3, table.size());
        assertEquals("estabilizacion con rcd", table.entriesLongestFirst().get(0).getKey());
        assertEquals("base", table.entriesLongestFirst().get(2).getKey());
    }

    @Test
    void lookup_longestKeywordWins() {
        KeywordModeResolver resolver = new KeywordModeResolver(table(), false);

        assertEquals(OperatingMode.CRITICAL, resolver.mode());
        assertEquals(Optional.of(new BigDecimal("1000")),
                resolver.lookup("suministro de base granular tipo a", "M3"));
        assertEquals(Optional.of(new BigDecimal("800")), resolver.lookup("base asfaltica", "M3"));
    }

    @Test
    void lookup_ignoresUnit() {
        KeywordModeResolver resolver = new KeywordModeResolver(table(), false);

        assertEquals(Optional.of(new BigDecimal("4500")), resolver.lookup("estabilizacion con rcd", ""));
    }

    @Test
    void lookup_substringMatchByDefault() {
        KeywordModeResolver resolver = new KeywordModeResolver(table(), false);

        assertTrue(resolver.lookup("subbase", "M3").isPresent());
    }

    @Test
    void lookup_wordBoundaryPolicy() {
        KeywordModeResolver resolver = new KeywordModeResolver(table(), true);

        assertTrue(resolver.lookup("subbase", "M3").isEmpty());
        assertEquals(Optional.of(new BigDecimal("800")), resolver.lookup("base asfaltica", "M3"));
    }

    @Test
    void lookup_noKeyword() {
        KeywordModeResolver resolver = new KeywordModeResolver(table(), false);

        assertTrue(resolver.lookup("excavacion mecanica", "M3").isEmpty());
        assertTrue(resolver.matchKeyword("excavacion mecanica").isEmpty());
    }
}
