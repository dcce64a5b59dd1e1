package com.raditha.astcore.symbols;

/**
 * A user-defined type resolved by the symbol database.
 */
public interface TypeSymbol {

    String name();

    boolean isEnumType();
}
