package com.raditha.astcore.symbols;

/**
 * A function resolved by the symbol database.
 */
public interface FunctionSymbol {

    String name();

    /**
     * True for lambda expressions; a token naming a lambda is classified
     * as {@code LAMBDA} instead of {@code FUNCTION}.
     */
    boolean isLambda();
}
