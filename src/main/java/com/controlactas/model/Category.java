package com.controlactas.model;

/**
 * Quantity families tracked independently of price matching.
 */
public enum Category {
    EXCAVATION("Excavaciones"),
    BACKFILL("Rellenos"),
    CONCRETE_MR("Concreto MR"),
    CONCRETE_STAMPED("Concreto estampado");

    private final String label;

    Category(String label) {
        this.label = label;
    }

    /**
     * Column label used in the generated workbooks.
     */
    public String label() {
        return label;
    }
}
