package com.raditha.astcore.symbols;

import com.raditha.astcore.model.Token;

/**
 * Library model answering whether a value is acceptable as a function argument.
 * <p>
 * Implementations are shared between workers and must be safe for
 * concurrent reads.
 */
public interface ArgumentValidityOracle {

    /**
     * @param functionToken the token naming the called function
     * @param argumentIndex 1-based argument position
     * @param value candidate integer value
     * @return true when the library accepts the value
     */
    boolean isIntArgValid(Token functionToken, int argumentIndex, long value);

    boolean isFloatArgValid(Token functionToken, int argumentIndex, double value);

    /**
     * Oracle that accepts every argument.
     */
    static ArgumentValidityOracle permissive() {
        return new ArgumentValidityOracle() {
            @Override
            public boolean isIntArgValid(Token functionToken, int argumentIndex, long value) {
                return true;
            }

            @Override
            public boolean isFloatArgValid(Token functionToken, int argumentIndex, double value) {
                return true;
            }
        };
    }
}
