package com.raditha.astcore.valueflow;

/**
 * How a lifetime fact refers to the object it borrows from.
 */
public enum LifetimeKind {
    /** Pointer or reference to the object itself */
    OBJECT("Object"),
    /** Member of the object */
    SUB_OBJECT("SubObject"),
    LAMBDA("Lambda"),
    ITERATOR("Iterator"),
    ADDRESS("Address");

    private final String label;

    LifetimeKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
