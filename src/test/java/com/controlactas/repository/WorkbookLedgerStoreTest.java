package com.controlactas.repository;

import com.controlactas.model.Category;
import com.controlactas.model.CategoryTotals;
import com.controlactas.model.OperatingMode;
import com.controlactas.model.Period;
import com.controlactas.model.ReconciliationRecord;
import com.controlactas.service.aggregation.ReconciliationAggregator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkbookLedgerStoreTest {

    @TempDir
    Path dataDir;

    private final WorkbookLedgerStore store = new WorkbookLedgerStore(new ReconciliationAggregator());

    private static final Period JULIO = new Period(2025, "julio", "julio2025");
    private static final Period AGOSTO = new Period(2025, "agosto", "agosto2025");

    private static ReconciliationRecord record(Period period, String contractor, String adjusted) {
        return new ReconciliationRecord(period.year(), period.month(), "acta1.xlsx", contractor, "1.1",
                "Excavación mecánica", "M3", new BigDecimal("1500"), new BigDecimal("1000"), BigDecimal.TEN,
                new BigDecimal(adjusted), OperatingMode.NORMAL);
    }

    private static CategoryTotals totals(Period period, String quantity) {
        return new CategoryTotals(period.year(), period.month(), "acta1.xlsx", "Alfa Ltda",
                Map.of(Category.EXCAVATION, new BigDecimal(quantity)), OperatingMode.CRITICAL);
    }

    @Test
    void load_missingFileIsEmpty() {
        WorkbookLedgerStore.Ledger ledger = store.load(dataDir);

        assertThat(ledger.records()).isEmpty();
        assertThat(ledger.totals()).isEmpty();
    }

    @Test
    void replacePeriod_roundTripsThroughWorkbook() {
        store.replacePeriod(dataDir, JULIO, List.of(record(JULIO, "Alfa Ltda", "10000")), List.of(totals(JULIO, "10")));

        assertThat(dataDir.resolve(WorkbookLedgerStore.LEDGER_FILE)).exists();
        WorkbookLedgerStore.Ledger ledger = store.load(dataDir);

        assertThat(ledger.records()).singleElement().satisfies(r -> {
            assertThat(r.year()).isEqualTo(2025);
            assertThat(r.month()).isEqualTo("julio");
            assertThat(r.contractor()).isEqualTo("Alfa Ltda");
            assertThat(r.itemCode()).isEqualTo("1.1");
            assertThat(r.adjustedValue()).isEqualByComparingTo("10000");
            assertThat(r.mode()).isEqualTo(OperatingMode.NORMAL);
        });
        assertThat(ledger.totals()).singleElement().satisfies(t -> {
            assertThat(t.quantity(Category.EXCAVATION)).isEqualByComparingTo("10");
            assertThat(t.quantity(Category.BACKFILL)).isEqualByComparingTo("0");
            assertThat(t.mode()).isEqualTo(OperatingMode.CRITICAL);
        });
    }

    @Test
    void replacePeriod_keepsOtherPeriodsAndReplacesItsOwn() {
        store.replacePeriod(dataDir, JULIO, List.of(record(JULIO, "Alfa Ltda", "1")), List.of(totals(JULIO, "1")));
        store.replacePeriod(dataDir, AGOSTO, List.of(record(AGOSTO, "Beta SAS", "2")), List.of(totals(AGOSTO, "2")));
        store.replacePeriod(dataDir, JULIO, List.of(record(JULIO, "Gama SA", "3")), List.of(totals(JULIO, "3")));

        WorkbookLedgerStore.Ledger ledger = store.load(dataDir);

        assertThat(ledger.records()).extracting(ReconciliationRecord::contractor).containsExactly("Beta SAS", "Gama SA");
        assertThat(ledger.totals()).hasSize(2);
    }

    @Test
    void replacePeriod_twiceGivesSameLedger() {
        List<ReconciliationRecord> records = List.of(record(JULIO, "Alfa Ltda", "10000"));
        List<CategoryTotals> totals = List.of(totals(JULIO, "10"));

        store.replacePeriod(dataDir, JULIO, records, totals);
        WorkbookLedgerStore.Ledger first = store.load(dataDir);
        store.replacePeriod(dataDir, JULIO, records, totals);

        assertThat(store.load(dataDir)).isEqualTo(first);
    }

    @Test
    void load_unreadableFileFails() throws Exception {
        Files.writeString(dataDir.resolve(WorkbookLedgerStore.LEDGER_FILE), "garbage");

        assertThatThrownBy(() -> store.load(dataDir)).isInstanceOf(LedgerWriteException.class);
    }
}
