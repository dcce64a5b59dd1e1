package com.raditha.astcore.valueflow;

/**
 * Whether a fact denotes an exact value or an open-ended range.
 */
public enum Bound {
    UPPER("Upper"),
    LOWER("Lower"),
    POINT("Point");

    private final String label;

    Bound(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
