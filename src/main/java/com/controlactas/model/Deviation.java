package com.controlactas.model;

import java.math.BigDecimal;

/**
 * Direction of a price deviation, used only to colour the verified workbook.
 */
public enum Deviation {
    OVERPAID("FFFF0000"),
    UNDERPAID("FF0000FF");

    private final String argbColor;

    Deviation(String argbColor) {
        this.argbColor = argbColor;
    }

    public String argbColor() {
        return argbColor;
    }

    public static Deviation of(BigDecimal difference) {
        return difference.signum() > 0 ? OVERPAID : UNDERPAID;
    }
}
