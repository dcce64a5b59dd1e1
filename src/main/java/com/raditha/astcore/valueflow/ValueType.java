package com.raditha.astcore.valueflow;

/**
 * What a fact is about.
 */
public enum ValueType {
    INT,
    TOK,
    FLOAT,
    MOVED,
    UNINIT,
    CONTAINER_SIZE,
    LIFETIME,
    BUFFER_SIZE,
    ITERATOR_START,
    ITERATOR_END,
    SYMBOLIC;

    /**
     * Types whose payload is the integer value.
     */
    public boolean isIntegral() {
        return switch (this) {
            case INT, CONTAINER_SIZE, BUFFER_SIZE, ITERATOR_START, ITERATOR_END, SYMBOLIC -> true;
            default -> false;
        };
    }
}
