package com.controlactas.service;

import com.controlactas.config.AppMetrics;
import com.controlactas.config.JacksonConfig;
import com.controlactas.model.Category;
import com.controlactas.model.FailureKind;
import com.controlactas.model.OperatingMode;
import com.controlactas.model.PeriodResult;
import com.controlactas.model.PriceReferenceEntry;
import com.controlactas.model.ReconciliationRecord;
import com.controlactas.repository.WorkbookLedgerStore;
import com.controlactas.service.aggregation.ReconciliationAggregator;
import com.controlactas.service.output.PeriodSummaryWriter;
import com.controlactas.service.output.VerifiedWorkbookWriter;
import com.controlactas.service.parsing.CertificateParser;
import com.controlactas.service.period.PeriodWorkspace;
import com.controlactas.service.period.ProjectLayout;
import com.controlactas.service.reconciliation.ReconciliationEngine;
import com.controlactas.service.reference.ExactModeResolver;
import com.controlactas.service.reference.KeywordModeResolver;
import com.controlactas.service.reference.KeywordPriceTable;
import com.controlactas.service.reference.ReferenceResolver;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.controlactas.CertificateWorkbooks.certificate;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs whole periods against workbooks on disk with the real components wired together.
 */
class ReconciliationBatchRunnerTest {

    @TempDir
    Path baseRoot;

    private ProjectLayout layout;
    private AppMetrics metrics;
    private WorkbookLedgerStore ledgerStore;
    private ReconciliationBatchRunner runner;

    @BeforeEach
    void setUp() {
        layout = new ProjectLayout(baseRoot, "Grupo 4");
        metrics = new AppMetrics(new SimpleMeterRegistry());
        ReconciliationAggregator aggregator = new ReconciliationAggregator();
        ledgerStore = new WorkbookLedgerStore(aggregator);
        runner = new ReconciliationBatchRunner(
                new CertificateParser(),
                new ReconciliationEngine(),
                aggregator,
                new VerifiedWorkbookWriter(),
                new PeriodSummaryWriter(new JacksonConfig().objectMapper()),
                ledgerStore,
                metrics);
    }

    private static ReferenceResolver normalResolver() {
        return ExactModeResolver.fromEntries(List.of(
                new PriceReferenceEntry("EXCAVACION MECANICA", new BigDecimal("1000"), "M3", null)));
    }

    private PeriodWorkspace workspace(String folder) {
        return layout.workspaceFor(folder).orElseThrow();
    }

    @Test
    @DisplayName("Overpaid excavation is flagged, written and added to the ledger")
    void normalModeEndToEnd() throws Exception {
        PeriodWorkspace julio = workspace("julio2025");
        certificate().contractor("Alfa Ltda")
                .item("1.1", "Excavación mecánica", "m³", 1500, 10)
                .item("1.2", "Relleno compactado", "m3", 700, 3)
                .writeTo(julio.certificatesDir(), "acta1.xlsx");

        PeriodResult result = runner.runPeriod(julio, normalResolver());

        assertThat(result.records()).singleElement().satisfies(r -> {
            assertThat(r.contractor()).isEqualTo("Alfa Ltda");
            assertThat(r.adjustedValue()).isEqualByComparingTo("10000");
            assertThat(r.mode()).isEqualTo(OperatingMode.NORMAL);
        });
        assertThat(result.categoryTotals()).singleElement().satisfies(t -> {
            assertThat(t.quantity(Category.EXCAVATION)).isEqualByComparingTo("10");
            assertThat(t.quantity(Category.BACKFILL)).isEqualByComparingTo("3");
        });
        assertThat(result.contractorSummaries()).singleElement()
                .satisfies(s -> assertThat(s.flaggedItems()).isEqualTo(1));

        assertThat(julio.outputDir().resolve("acta1_verificado.xlsx")).exists();
        assertThat(julio.periodSummaryDir().resolve("resumen_julio2025.xlsx")).exists();
        assertThat(julio.periodSummaryDir().resolve(PeriodSummaryWriter.RUN_REPORT_FILE)).exists();
        assertThat(julio.summaryDir().resolve(PeriodSummaryWriter.GLOBAL_SUMMARY_FILE)).exists();
        assertThat(ledgerStore.load(julio.dataDir()).records()).hasSize(1);

        assertThat(result.report().certificatesFound()).isEqualTo(1);
        assertThat(result.report().certificatesProcessed()).isEqualTo(1);
        assertThat(result.report().recordsFlagged()).isEqualTo(1);
        assertThat(metrics.getRecordsFlaggedCounter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Critical mode prices by keyword and counts unmatched excavation")
    void criticalModeEndToEnd() throws Exception {
        PeriodWorkspace agosto = workspace("agosto2025");
        certificate().contractor("Beta SAS")
                .item("2.1", "Suministro de base granular", "m3", 1200, 5)
                .item("2.2", "Excavación manual en zanja", "m3", 30000, 50)
                .writeTo(agosto.certificatesDir(), "acta7.xlsx");

        Map<String, BigDecimal> keywords = new LinkedHashMap<>();
        keywords.put("BASE GRANULAR", new BigDecimal("1000"));
        keywords.put("EXCAVACION MECANICA", new BigDecimal("1000"));
        ReferenceResolver resolver = new KeywordModeResolver(KeywordPriceTable.of(keywords), false);

        PeriodResult result = runner.runPeriod(agosto, resolver);

        assertThat(result.mode()).isEqualTo(OperatingMode.CRITICAL);
        assertThat(result.records()).singleElement().satisfies(r -> {
            assertThat(r.itemCode()).isEqualTo("2.1");
            assertThat(r.adjustedValue()).isEqualByComparingTo("5000");
            assertThat(r.mode()).isEqualTo(OperatingMode.CRITICAL);
        });
        assertThat(result.categoryTotals().get(0).quantity(Category.EXCAVATION)).isEqualByComparingTo("50");
    }

    @Test
    @DisplayName("Unreadable and malformed certificates are reported, the rest is processed")
    void failuresAreReportedAndSkipped() throws Exception {
        PeriodWorkspace julio = workspace("julio2025");
        certificate().item("1.1", "Excavación mecánica", "m3", 1500, 10)
                .writeTo(julio.certificatesDir(), "acta1.xlsx");
        certificate().sheetName("OTRA").writeTo(julio.certificatesDir(), "acta2.xlsx");
        Files.writeString(julio.certificatesDir().resolve("acta3.xlsx"), "not a workbook");
        Files.writeString(julio.certificatesDir().resolve("~$acta1.xlsx"), "lock");

        PeriodResult result = runner.runPeriod(julio, normalResolver());

        assertThat(result.report().certificatesFound()).isEqualTo(3);
        assertThat(result.report().certificatesProcessed()).isEqualTo(1);
        assertThat(result.report().failures())
                .extracting(f -> f.fileName() + ":" + f.kind())
                .containsExactly("acta2.xlsx:" + FailureKind.MISSING_SHEET, "acta3.xlsx:" + FailureKind.UNREADABLE);
        assertThat(result.records()).hasSize(1);
        assertThat(metrics.getCertificatesFailedCounter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Re-running a period leaves the ledger unchanged")
    void rerunIsIdempotent() throws Exception {
        PeriodWorkspace julio = workspace("julio2025");
        certificate().item("1.1", "Excavación mecánica", "m3", 1500, 10)
                .writeTo(julio.certificatesDir(), "acta1.xlsx");

        runner.runPeriod(julio, normalResolver());
        WorkbookLedgerStore.Ledger first = ledgerStore.load(julio.dataDir());
        runner.runPeriod(julio, normalResolver());
        WorkbookLedgerStore.Ledger second = ledgerStore.load(julio.dataDir());

        assertThat(second).isEqualTo(first);
        assertThat(second.records()).hasSize(1);
    }

    @Test
    @DisplayName("Empty period still writes its summaries")
    void emptyPeriodWritesSummaries() throws Exception {
        PeriodWorkspace marzo = workspace("marzo2025");
        Files.createDirectories(marzo.certificatesDir());

        PeriodResult result = runner.runPeriod(marzo, normalResolver());

        assertThat(result.records()).isEmpty();
        assertThat(result.report().certificatesFound()).isZero();
        assertThat(marzo.periodSummaryDir().resolve("resumen_marzo2025.xlsx")).exists();
    }

    @Test
    @DisplayName("Batch keeps every period in the ledger")
    void batchAccumulatesPeriods() throws Exception {
        certificate().contractor("Alfa Ltda").item("1.1", "Excavación mecánica", "m3", 1500, 10)
                .writeTo(workspace("julio2025").certificatesDir(), "acta1.xlsx");
        certificate().contractor("Beta SAS").item("1.1", "Excavación mecánica", "m3", 800, 2)
                .writeTo(workspace("agosto2025").certificatesDir(), "acta1.xlsx");

        List<PeriodResult> results = runner.runBatch(layout.listPeriods(), normalResolver());

        assertThat(results).extracting(r -> r.period().month()).containsExactly("julio", "agosto");
        List<ReconciliationRecord> ledger = ledgerStore.load(workspace("julio2025").dataDir()).records();
        assertThat(ledger).extracting(ReconciliationRecord::contractor).containsExactly("Alfa Ltda", "Beta SAS");
    }
}
