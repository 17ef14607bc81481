package com.controlactas.service;

import com.controlactas.config.AppMetrics;
import com.controlactas.config.RunContext;
import com.controlactas.model.CategoryTotals;
import com.controlactas.model.CertificateFailure;
import com.controlactas.model.ContractorCategorySummary;
import com.controlactas.model.ContractorSummary;
import com.controlactas.model.FailureKind;
import com.controlactas.model.Period;
import com.controlactas.model.PeriodResult;
import com.controlactas.model.ReconciliationRecord;
import com.controlactas.model.RunReport;
import com.controlactas.repository.WorkbookLedgerStore;
import com.controlactas.service.aggregation.ReconciliationAggregator;
import com.controlactas.service.output.PeriodSummaryWriter;
import com.controlactas.service.output.VerifiedWorkbookWriter;
import com.controlactas.service.parsing.CertificateParseException;
import com.controlactas.service.parsing.CertificateParser;
import com.controlactas.service.parsing.ParsedCertificate;
import com.controlactas.service.period.PeriodWorkspace;
import com.controlactas.service.reconciliation.CertificateReconciliation;
import com.controlactas.service.reconciliation.ReconciliationEngine;
import com.controlactas.service.reference.ReferenceResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the reconciliation of one or more periods.
 *
 * Per period:
 * 1. Parse, reconcile and write the verified copy of each certificate, one at a time
 * 2. Replace the period in the cross-period ledger
 * 3. Write the period summary, the global summary and the run report
 *
 * A certificate that cannot be read or written is reported and skipped; ledger and
 * summary failures abort the run.
 */
@Service
@Slf4j
public class ReconciliationBatchRunner {

    private final CertificateParser parser;
    private final ReconciliationEngine engine;
    private final ReconciliationAggregator aggregator;
    private final VerifiedWorkbookWriter verifiedWriter;
    private final PeriodSummaryWriter summaryWriter;
    private final WorkbookLedgerStore ledgerStore;
    private final AppMetrics metrics;

    public ReconciliationBatchRunner(CertificateParser parser,
                                     ReconciliationEngine engine,
                                     ReconciliationAggregator aggregator,
                                     VerifiedWorkbookWriter verifiedWriter,
                                     PeriodSummaryWriter summaryWriter,
                                     WorkbookLedgerStore ledgerStore,
                                     AppMetrics metrics) {
        this.parser = parser;
        this.engine = engine;
        this.aggregator = aggregator;
        this.verifiedWriter = verifiedWriter;
        this.summaryWriter = summaryWriter;
        this.ledgerStore = ledgerStore;
        this.metrics = metrics;
    }

    /**
     * Runs the periods in order with the same reference snapshot.
     */
    public List<PeriodResult> runBatch(List<PeriodWorkspace> workspaces, ReferenceResolver resolver) {
        List<PeriodResult> results = new ArrayList<>();
        try (RunContext ignored = RunContext.openRun()) {
            log.info("Batch of {} periods, mode {}", workspaces.size(), resolver.mode());
            for (PeriodWorkspace workspace : workspaces) {
                results.add(runPeriod(workspace, resolver));
            }
        }
        return results;
    }

    public PeriodResult runPeriod(PeriodWorkspace workspace, ReferenceResolver resolver) {
        Period period = workspace.period();
        try (RunContext ignored = RunContext.open(period)) {
            Instant startedAt = Instant.now();
            long start = System.currentTimeMillis();

            List<Path> certificates = workspace.certificates();
            log.info("═══════════════════════════════════════════════════════════════");
            log.info("PERIOD START: {} {} | {} certificates | Mode: {}",
                    period.month(), period.year(), certificates.size(), resolver.mode());
            log.info("═══════════════════════════════════════════════════════════════");

            try {
                workspace.createOutputDirectories();
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create output folders for " + period.folderName(), e);
            }

            // STAGE 1: certificates, each one finished before the next
            List<ReconciliationRecord> records = new ArrayList<>();
            List<CategoryTotals> totals = new ArrayList<>();
            List<CertificateFailure> failures = new ArrayList<>();
            List<Path> artifacts = new ArrayList<>();

            for (Path certificate : certificates) {
                long certificateStart = System.currentTimeMillis();
                String fileName = certificate.getFileName().toString();

                ParsedCertificate parsed;
                try {
                    parsed = parser.parse(certificate);
                } catch (CertificateParseException e) {
                    log.warn("Skipping {}: {} ({})", fileName, e.getKind(), e.getMessage());
                    failures.add(new CertificateFailure(fileName, e.getKind(), e.getMessage()));
                    continue;
                }

                CertificateReconciliation reconciliation = engine.reconcile(period, parsed, resolver);
                try {
                    artifacts.add(verifiedWriter.write(parsed, reconciliation, workspace.outputDir()));
                } catch (IOException e) {
                    log.warn("Cannot write verified copy of {}, discarding its records", fileName, e);
                    failures.add(new CertificateFailure(fileName, FailureKind.OUTPUT_WRITE, e.getMessage()));
                    continue;
                }

                records.addAll(reconciliation.records());
                totals.add(reconciliation.categoryTotals());
                metrics.recordCertificate(System.currentTimeMillis() - certificateStart);
                log.info("  {} | contractor={} | items={} | flagged={}",
                        fileName, parsed.contractor(), parsed.items().size(), reconciliation.records().size());
            }

            // STAGE 2: ledger
            WorkbookLedgerStore.Ledger ledger = ledgerStore.replacePeriod(workspace.dataDir(), period, records, totals);

            // STAGE 3: summaries
            List<ContractorSummary> contractorSummaries = aggregator.summarizeByContractor(records);
            List<ContractorCategorySummary> categorySummaries = aggregator.summarizeCategories(totals);
            int processed = certificates.size() - failures.size();
            RunReport report = new RunReport(period, resolver.mode(), certificates.size(), processed,
                    List.copyOf(failures), records.size(), startedAt, System.currentTimeMillis() - start);
            try {
                artifacts.add(summaryWriter.writePeriodSummary(workspace.periodSummaryDir(), period.folderName(),
                        contractorSummaries, records, categorySummaries));
                artifacts.add(summaryWriter.writeGlobalSummary(workspace.summaryDir(),
                        aggregator.summarizeGlobal(ledger.records()), ledger.records()));
                artifacts.add(summaryWriter.writeRunReport(workspace.periodSummaryDir(), report));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot write summaries for " + period.folderName(), e);
            }

            long elapsed = System.currentTimeMillis() - start;
            metrics.recordPeriodRun(elapsed);
            metrics.incrementCertificates(certificates.size(), processed, failures.size());
            metrics.incrementRecordsFlagged(records.size());

            log.info("═══════════════════════════════════════════════════════════════");
            log.info("PERIOD COMPLETE: {} {} | Total: {}ms", period.month(), period.year(), elapsed);
            log.info("  Found: {} | Processed: {} | Failed: {} | Flagged: {}",
                    certificates.size(), processed, failures.size(), records.size());
            log.info("═══════════════════════════════════════════════════════════════");

            return new PeriodResult(period, resolver.mode(), List.copyOf(records), List.copyOf(totals),
                    contractorSummaries, categorySummaries, List.copyOf(artifacts), report);
        }
    }
}
