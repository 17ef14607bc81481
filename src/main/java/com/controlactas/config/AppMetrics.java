package com.controlactas.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Reconciliation metrics.
 *
 * Key metrics:
 * - actas.certificates.found      → Certificates discovered in period folders
 * - actas.certificates.processed  → Certificates reconciled and written
 * - actas.certificates.failed     → Certificates skipped (unreadable, missing sheet, ...)
 * - actas.records.flagged         → Line items outside tolerance
 * - actas.period.run              → Time per period run
 * - actas.certificate.reconcile   → Time per certificate (parse + reconcile + write)
 * - actas.reference.load          → Time to build the reference snapshot
 */
@Component
@Getter
public class AppMetrics {

    private final Timer periodRunTimer;
    private final Timer certificateTimer;
    private final Timer referenceLoadTimer;

    private final Counter certificatesFoundCounter;
    private final Counter certificatesProcessedCounter;
    private final Counter certificatesFailedCounter;
    private final Counter recordsFlaggedCounter;

    public AppMetrics(MeterRegistry registry) {
        this.periodRunTimer = Timer.builder("actas.period.run")
                .description("Time to reconcile every certificate of a period")
                .register(registry);

        this.certificateTimer = Timer.builder("actas.certificate.reconcile")
                .description("Parse, reconcile and write one certificate")
                .register(registry);

        this.referenceLoadTimer = Timer.builder("actas.reference.load")
                .description("Reference price snapshot construction")
                .register(registry);

        this.certificatesFoundCounter = Counter.builder("actas.certificates.found")
                .description("Certificates discovered")
                .register(registry);

        this.certificatesProcessedCounter = Counter.builder("actas.certificates.processed")
                .description("Certificates reconciled successfully")
                .register(registry);

        this.certificatesFailedCounter = Counter.builder("actas.certificates.failed")
                .description("Certificates skipped with a diagnostic")
                .register(registry);

        this.recordsFlaggedCounter = Counter.builder("actas.records.flagged")
                .description("Line items whose declared price deviates from the reference")
                .register(registry);
    }

    public void recordPeriodRun(long millis) {
        periodRunTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordCertificate(long millis) {
        certificateTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordReferenceLoad(long millis) {
        referenceLoadTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void incrementCertificates(int found, int processed, int failed) {
        certificatesFoundCounter.increment(found);
        certificatesProcessedCounter.increment(processed);
        certificatesFailedCounter.increment(failed);
    }

    public void incrementRecordsFlagged(int count) {
        recordsFlaggedCounter.increment(count);
    }
}
