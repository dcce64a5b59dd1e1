package com.raditha.astcore.symbols;

/**
 * A variable resolved by the symbol database.
 */
public interface VariableSymbol {

    /**
     * Stable id shared by every token that refers to this variable.
     */
    int declarationId();

    String name();
}
