package com.raditha.astcore.model;

/**
 * Boolean attributes of a token.
 * Some are derived from the token text on classification, the rest are set
 * by simplification passes.
 */
public enum TokenFlag {
    UNSIGNED,
    SIGNED,
    LONG,
    COMPLEX,
    STANDARD_TYPE,
    EXPANDED_MACRO,
    CONTROL_FLOW_KEYWORD,
    CAST,
    POINTER_COMPARE,
    ENUM_TYPE,
    TEMPLATE,
    SPLIT_VAR_DECL_COMMA,
    SPLIT_VAR_DECL_EQ,
    IMPLICIT_INT,
    INLINE,
    ATTRIBUTE_CONSTRUCTOR,
    ATTRIBUTE_NORETURN,
    INCOMPLETE_VAR
}
