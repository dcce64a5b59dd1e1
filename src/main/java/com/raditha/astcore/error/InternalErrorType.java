package com.raditha.astcore.error;

/**
 * Category of an analyzer-internal failure.
 */
public enum InternalErrorType {
    /** Broken expression tree: cyclic parent chain, unresolvable expression range. */
    AST,

    /** Token sequence that violates a structural expectation, such as unmatched brackets. */
    SYNTAX,

    /** Misuse of the core API by an analysis pass. */
    INTERNAL
}
