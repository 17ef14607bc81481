package com.controlactas.model;

/**
 * Anything stored in the cross-period ledger, keyed by (year, month).
 */
public interface PeriodScoped {

    int year();

    String month();

    default boolean belongsTo(Period period) {
        return year() == period.year() && month().equals(period.month());
    }
}
