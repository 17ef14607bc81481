package com.controlactas.model;

public enum FailureKind {
    UNREADABLE,
    MISSING_SHEET,
    MISSING_COLUMNS,
    OUTPUT_WRITE
}
