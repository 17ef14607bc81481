package com.controlactas.service.period;

import com.controlactas.model.Period;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PeriodParserTest {

    @Test
    void parse_fullMonthName() {
        assertEquals(Optional.of(new Period(2025, "julio", "julio2025")), PeriodParser.parse("julio2025"));
    }

    @Test
    void parse_abbreviationIsCanonicalized() {
        Optional<Period> period = PeriodParser.parse("Actas_SEP_2024");
        assertTrue(period.isPresent());
        assertEquals(2024, period.get().year());
        assertEquals("septiembre", period.get().month());
        assertEquals("Actas_SEP_2024", period.get().folderName());
    }

    @Test
    void parse_setiembreVariant() {
        assertEquals("septiembre", PeriodParser.parse("setiembre 2023").orElseThrow().month());
    }

    @Test
    void parse_requiresYearAndMonth() {
        assertTrue(PeriodParser.parse("julio").isEmpty());
        assertTrue(PeriodParser.parse("2025").isEmpty());
        assertTrue(PeriodParser.parse("borrador").isEmpty());
        assertTrue(PeriodParser.parse(null).isEmpty());
    }

    @Test
    void monthNumber_knownAndUnknown() {
        assertEquals(1, PeriodParser.monthNumber("enero"));
        assertEquals(12, PeriodParser.monthNumber("DICIEMBRE"));
        assertEquals(0, PeriodParser.monthNumber("brumario"));
    }
}
