package com.controlactas.service.parsing;

import lombok.Getter;
import lombok.ToString;

/**
 * Row counters for one certificate, logged after parsing so dropped rows are visible.
 */
@Getter
@ToString
public class ParseStatistics {

    private int rowsScanned;
    private int missingItemOrDescription;
    private int excludedLabor;
    private int missingPrice;
    private int unparsablePrice;
    private int invalidQuantity;
    private int emitted;

    void rowScanned() { rowsScanned++; }

    void missingItemOrDescription() { missingItemOrDescription++; }

    void excludedLabor() { excludedLabor++; }

    void missingPrice() { missingPrice++; }

    void unparsablePrice() { unparsablePrice++; }

    void invalidQuantity() { invalidQuantity++; }

    void emitted() { emitted++; }
}
