package com.controlactas.model;

import java.time.Instant;
import java.util.List;

/**
 * Run-level outcome of one period. certificatesFound versus certificatesProcessed
 * makes skipped files visible.
 */
public record RunReport(
    Period period,
    OperatingMode mode,
    int certificatesFound,
    int certificatesProcessed,
    List<CertificateFailure> failures,
    int recordsFlagged,
    Instant startedAt,
    long elapsedMs
) {}
