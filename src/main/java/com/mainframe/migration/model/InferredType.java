package com.mainframe.migration.model;

/**
 * Target type kind inferred from a PIC clause.
 */
public enum InferredType {

    STRING("string"),
    SHORT_INTEGER("shortInteger"),
    INTEGER("integer"),
    LONG_INTEGER("longInteger"),
    DECIMAL("decimal");

    private final String label;

    InferredType(String label) {
        this.label = label;
    }

    /**
     * Stable external name used in reports.
     */
    public String getLabel() {
        return label;
    }

    public boolean isIntegral() {
        return this == SHORT_INTEGER || this == INTEGER || this == LONG_INTEGER;
    }
}
