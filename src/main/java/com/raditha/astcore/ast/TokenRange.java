package com.raditha.astcore.ast;

import com.raditha.astcore.model.Token;

/**
 * Inclusive range of tokens in one sequence.
 *
 * @param start first token
 * @param end   last token
 */
public record TokenRange(Token start, Token end) {
}
