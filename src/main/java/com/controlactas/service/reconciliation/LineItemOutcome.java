package com.controlactas.service.reconciliation;

/**
 * Terminal states of a classified line item.
 */
public enum LineItemOutcome {
    /** no reference price; dropped from the flagged stream */
    NO_REFERENCE,
    WITHIN_TOLERANCE,
    FLAGGED
}
