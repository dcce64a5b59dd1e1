package com.raditha.astcore.valueflow;

public enum LifetimeScope {
    LOCAL("Local"),
    ARGUMENT("Argument"),
    SUB_FUNCTION("SubFunction"),
    THIS_POINTER("ThisPointer"),
    THIS_VALUE("ThisValue");

    private final String label;

    LifetimeScope(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
