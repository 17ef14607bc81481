package com.controlactas.service.text;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextNormalizerTest {

    @Test
    void normalizeText_stripsAccentsPunctuationAndCase() {
        assertEquals("excavacion mecanica en material comun",
                TextNormalizer.normalizeText("  EXCAVACIÓN Mecánica, en material  común. "));
    }

    @Test
    void normalizeText_isIdempotent() {
        String once = TextNormalizer.normalizeText("Relleno con material seleccionado (tipo B-200)");
        assertEquals(once, TextNormalizer.normalizeText(once));
    }

    @Test
    void normalizeText_nullStaysNull() {
        assertNull(TextNormalizer.normalizeText(null));
    }

    @Test
    void normalizeUnit_mapsCubicAndSquareSymbols() {
        assertEquals("M3", TextNormalizer.normalizeUnit("m³"));
        assertEquals("M3", TextNormalizer.normalizeUnit("M^3"));
        assertEquals("M2", TextNormalizer.normalizeUnit(" m² "));
    }

    @Test
    void normalizeUnit_mapsSynonyms() {
        assertEquals("UN", TextNormalizer.normalizeUnit("und"));
        assertEquals("UN", TextNormalizer.normalizeUnit("Unidad"));
        assertEquals("UN", TextNormalizer.normalizeUnit("U"));
        assertEquals("M", TextNormalizer.normalizeUnit("ml"));
    }

    @Test
    void normalizeUnit_nullIsEmpty() {
        assertEquals("", TextNormalizer.normalizeUnit(null));
    }

    @Test
    void normalizeUnit_isIdempotent() {
        for (String unit : new String[]{"m³", "UND", "ml", "Kg", "m 2"}) {
            String once = TextNormalizer.normalizeUnit(unit);
            assertEquals(once, TextNormalizer.normalizeUnit(once), unit);
        }
    }

    @Test
    void normalizeHeader_comparesAccentFree() {
        assertEquals(TextNormalizer.normalizeHeader("ITEM"), TextNormalizer.normalizeHeader("Ítem"));
        assertEquals("VALOR UNITARIO", TextNormalizer.normalizeHeader(" valor   unitario "));
    }
}
