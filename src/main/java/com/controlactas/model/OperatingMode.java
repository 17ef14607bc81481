package com.controlactas.model;

/**
 * Reference lookup strategy used for a run.
 * NORMAL matches (description, unit) exactly against the price store,
 * CRITICAL matches a short keyword table by substring.
 */
public enum OperatingMode {
    NORMAL,
    CRITICAL
}
