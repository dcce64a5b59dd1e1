package com.raditha.astcore.model;

/**
 * Front and back anchor of one token sequence.
 * Shared by every token of the sequence; structural mutations that move a
 * boundary token update it.
 */
public final class TokensFrontBack {
    Token front;
    Token back;

    public Token front() {
        return front;
    }

    public Token back() {
        return back;
    }
}
