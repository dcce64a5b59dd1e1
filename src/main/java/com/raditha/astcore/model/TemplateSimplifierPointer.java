package com.raditha.astcore.model;

/**
 * Auxiliary bookkeeping that refers to a token by identity, such as a
 * pending template instantiation. Registered on the token so that payload
 * moves ({@link Token#swapWithNext()}, {@link Token#deleteThis()}) can
 * repoint it, and cleared when the token is removed.
 */
public class TemplateSimplifierPointer {

    private Token token;

    public TemplateSimplifierPointer(Token token) {
        this.token = token;
        if (token != null) {
            token.addTemplateSimplifierPointer(this);
        }
    }

    public Token token() {
        return token;
    }

    /**
     * Repoint to another token. Called by the token itself when its payload moves.
     */
    void token(Token token) {
        this.token = token;
    }
}
