package com.raditha.astcore.model;

/**
 * Classification of a token.
 * Assigned from the token text by {@link Token#setStr(String)} and refined
 * by symbol lookups (variable, function and type references).
 */
public enum TokenKind {
    /** Plain identifier without a resolved symbol */
    NAME(true, false),

    /** Identifier with a non-zero varId or a resolved variable */
    VARIABLE(true, false),

    /** Standard or resolved type name */
    TYPE(true, false),

    /** Identifier referring to a resolved function */
    FUNCTION(true, false),

    /** Identifier referring to a lambda */
    LAMBDA(false, false),

    /** Language keyword */
    KEYWORD(true, false),

    /** Integer or floating point literal */
    NUMBER(false, true),

    /** String literal, possibly prefixed */
    STRING(false, true),

    /** Character literal, possibly prefixed */
    CHAR(false, true),

    /** true / false */
    BOOLEAN(true, true),

    /** Other literal, such as nullptr */
    LITERAL(false, true),

    /** Enumerator constant */
    ENUMERATOR(true, true),

    /** + - * / % &lt;&lt; &gt;&gt; */
    ARITHMETICAL_OP(false, false),

    /** == != &lt; &lt;= &gt; &gt;= &lt;=&gt; */
    COMPARISON_OP(false, false),

    /** = += -= ... */
    ASSIGNMENT_OP(false, false),

    /** &amp;&amp; || ! */
    LOGICAL_OP(false, false),

    /** &amp; | ^ ~ */
    BIT_OP(false, false),

    /** ++ -- */
    INC_DEC_OP(false, false),

    /** , [ ] ( ) ? : */
    EXTENDED_OP(false, false),

    /** { } and linked template angle brackets */
    BRACKET(false, false),

    /** ... */
    ELLIPSIS(false, false),

    /** Anything else */
    OTHER(false, false),

    /** Empty token text */
    NONE(false, false);

    private final boolean name;
    private final boolean literal;

    TokenKind(boolean name, boolean literal) {
        this.name = name;
        this.literal = literal;
    }

    public boolean isName() {
        return name;
    }

    public boolean isLiteral() {
        return literal;
    }
}
