package com.raditha.astcore.valueflow;

public enum MoveKind {
    NON_MOVED_VARIABLE("NonMovedVariable"),
    MOVED_VARIABLE("MovedVariable"),
    FORWARDED_VARIABLE("ForwardedVariable");

    private final String label;

    MoveKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
