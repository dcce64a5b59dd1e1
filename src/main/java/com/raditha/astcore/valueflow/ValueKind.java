package com.raditha.astcore.valueflow;

/**
 * Certainty of a fact.
 */
public enum ValueKind {
    /** May hold on some path */
    POSSIBLE,
    /** Always holds */
    KNOWN,
    /** Never holds */
    IMPOSSIBLE,
    /** Derived through guesswork */
    INCONCLUSIVE
}
