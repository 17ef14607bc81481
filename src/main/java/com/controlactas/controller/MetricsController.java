package com.controlactas.controller;

import com.controlactas.config.AppMetrics;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Reconciliation counters and timings in a single response.
 *
 * GET /api/metrics/summary
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private final AppMetrics appMetrics;

    @GetMapping("/summary")
    public Map<String, Object> getMetricsSummary() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("timestamp", Instant.now().toString());
        response.put("certificates", getCertificateMetrics());
        response.put("timing", getTimingMetrics());
        return response;
    }

    @GetMapping("/certificates")
    public Map<String, Object> getCertificateMetrics() {
        Map<String, Object> certificates = new LinkedHashMap<>();

        double found = appMetrics.getCertificatesFoundCounter().count();
        double processed = appMetrics.getCertificatesProcessedCounter().count();

        certificates.put("found", (long) found);
        certificates.put("processed", (long) processed);
        certificates.put("failed", (long) appMetrics.getCertificatesFailedCounter().count());
        certificates.put("recordsFlagged", (long) appMetrics.getRecordsFlaggedCounter().count());
        certificates.put("processedRate", found > 0 ? String.format("%.2f%%", (processed / found) * 100) : "N/A");
        return certificates;
    }

    @GetMapping("/timing")
    public Map<String, Object> getTimingMetrics() {
        Map<String, Object> timing = new LinkedHashMap<>();
        timing.put("periodRun", getTimerStats(appMetrics.getPeriodRunTimer()));
        timing.put("certificate", getTimerStats(appMetrics.getCertificateTimer()));
        timing.put("referenceLoad", getTimerStats(appMetrics.getReferenceLoadTimer()));
        return timing;
    }

    private Map<String, Object> getTimerStats(Timer timer) {
        Map<String, Object> stats = new LinkedHashMap<>();
        long count = timer.count();
        stats.put("count", count);
        if (count > 0) {
            stats.put("totalTimeMs", String.format("%.2f", timer.totalTime(TimeUnit.MILLISECONDS)));
            stats.put("avgTimeMs", String.format("%.2f", timer.mean(TimeUnit.MILLISECONDS)));
            stats.put("maxTimeMs", String.format("%.2f", timer.max(TimeUnit.MILLISECONDS)));
        } else {
            stats.put("totalTimeMs", "0.00");
            stats.put("avgTimeMs", "N/A");
        }
        return stats;
    }
}
