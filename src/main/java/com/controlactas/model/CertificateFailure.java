package com.controlactas.model;

/**
 * Certificate skipped during a run, kept for the run report.
 */
public record CertificateFailure(
    String fileName,
    FailureKind kind,
    String message
) {}
