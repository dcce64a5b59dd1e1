package com.raditha.astcore.match;

import com.raditha.astcore.error.InternalAnalysisException;
import com.raditha.astcore.model.Token;
import com.raditha.astcore.model.TokenKind;

import java.util.HashMap;
import java.util.Map;

/**
 * Token classes that can be named in a pattern as {@code %name%}.
 */
public enum Wildcard {
    ANY("any"),
    NAME("name"),
    TYPE("type"),
    VAR("var"),
    VARID("varid"),
    NUM("num"),
    STR("str"),
    CHAR("char"),
    BOOL("bool"),
    ASSIGN("assign"),
    COMP("comp"),
    COP("cop"),
    OP("op"),
    OR("or"),
    OROR("oror");

    private static final Map<String, Wildcard> BY_TEXT = new HashMap<>();

    static {
        for (Wildcard w : values()) {
            BY_TEXT.put(w.text, w);
        }
    }

    private final String text;

    Wildcard(String name) {
        this.text = "%" + name + "%";
    }

    /**
     * The pattern text, percent signs included.
     */
    public String text() {
        return text;
    }

    /**
     * Look up a wildcard by its pattern text.
     *
     * @return null when the text is not a known wildcard
     */
    public static Wildcard fromText(String text) {
        return BY_TEXT.get(text);
    }

    boolean matches(Token tok, int varId) {
        return switch (this) {
            case ANY -> true;
            case NAME -> tok.isName();
            case TYPE -> tok.isName() && tok.varId() == 0;
            case VAR -> tok.varId() != 0;
            case VARID -> {
                if (varId == 0) {
                    throw new InternalAnalysisException(tok,
                            "Internal error. Token::Match called with varid 0. Please report this to Cppcheck developers");
                }
                yield tok.varId() == varId;
            }
            case NUM -> tok.isNumber();
            case STR -> tok.kind() == TokenKind.STRING;
            case CHAR -> tok.kind() == TokenKind.CHAR;
            case BOOL -> tok.isBoolean();
            case ASSIGN -> tok.isAssignmentOp();
            case COMP -> tok.isComparisonOp();
            case COP -> tok.isConstOp();
            case OP -> tok.isOp();
            case OR -> tok.kind() == TokenKind.BIT_OP && tok.str().equals("|");
            case OROR -> tok.kind() == TokenKind.LOGICAL_OP && tok.str().equals("||");
        };
    }
}
