package com.raditha.astcore.ast;

import com.raditha.astcore.error.InternalAnalysisException;
import com.raditha.astcore.error.InternalErrorType;
import com.raditha.astcore.match.TokenMatcher;
import com.raditha.astcore.model.Token;
import com.raditha.astcore.model.TokenKind;
import org.jspecify.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Queries over the expression tree and the bracket structure of a token sequence.
 * <p>
 * The bracket and argument walkers are heuristics over raw tokens: when
 * the structure cannot be decided they return null instead of guessing.
 */
public class AstNavigator {

    /** How far {@link #isUnaryPreOp(Token)} looks for the operand of ++ and --. */
    static final int PRE_OP_SCAN_DISTANCE = 10;

    private AstNavigator() {
        /* this is only a utility class */
    }

    /**
     * Whether {@code tok1} comes before {@code tok2}. A null {@code tok2}
     * counts as the end of the sequence.
     */
    public static boolean precedes(@Nullable Token tok1, @Nullable Token tok2) {
        if (tok1 == tok2 || tok1 == null) {
            return false;
        }
        if (tok2 == null) {
            return true;
        }
        return tok1.index() < tok2.index();
    }

    public static boolean succeeds(@Nullable Token tok1, @Nullable Token tok2) {
        if (tok1 == tok2 || tok1 == null) {
            return false;
        }
        if (tok2 == null) {
            return true;
        }
        return tok1.index() > tok2.index();
    }

    private static boolean isOperator(Token tok) {
        if (tok.link() != null) {
            tok = tok.link();
        }
        return tok.strAt(-1).equals("operator");
    }

    /**
     * The {@code >} closing the template argument list opened by {@code tok}.
     *
     * @return null when {@code tok} is not a {@code <} that looks like a
     *         template opener, or when no consistent closer exists
     */
    public static @Nullable Token findClosingBracket(Token tok) {
        if (tok == null || !tok.str().equals("<")) {
            return null;
        }
        Token prev = tok.previous();
        if (prev == null) {
            return null;
        }
        if (!(prev.isName() || TokenMatcher.simpleMatch(prev, "]")
                || TokenMatcher.match(prev.previous(), "operator %op% <")
                || TokenMatcher.match(prev.tokAt(-2), "operator [([] [)]] <"))) {
            return null;
        }

        boolean templateParameter = tok.strAt(-1).equals("template");
        Set<String> templateParameters = new HashSet<>();

        boolean isDecl = true;
        for (Token p = prev; p != null; p = p.previous()) {
            if (p.str().equals("=")) {
                isDecl = false;
            }
            if (TokenMatcher.simpleMatch(p, "template <")) {
                isDecl = true;
            }
            if (TokenMatcher.match(p, "[;{}]")) {
                break;
            }
        }

        int depth = 0;
        Token closing;
        for (closing = tok; closing != null; closing = closing.next()) {
            if (TokenMatcher.match(closing, "{|[|(")) {
                closing = closing.link();
                if (closing == null) {
                    return null;
                }
            } else if (TokenMatcher.match(closing, "}|]|)|;")) {
                return null;
            } else if (closing.str().equals("<") && closing.previous() != null
                    && (closing.previous().isName() || TokenMatcher.simpleMatch(closing.previous(), "]")
                    || isOperator(closing.previous()))
                    && (!templateParameter || !templateParameters.contains(closing.strAt(-1)))) {
                ++depth;
            } else if (closing.str().equals(">")) {
                if (--depth == 0) {
                    return closing;
                }
            } else if (closing.str().equals(">>") || closing.str().equals(">>=")) {
                if (!isDecl && depth == 1) {
                    continue;
                }
                if (depth <= 2) {
                    return closing;
                }
                depth -= 2;
            } else if (templateParameter && depth == 1 && TokenMatcher.match(closing, "[,=]")
                    && closing.previous().isName() && !TokenMatcher.match(closing.previous(), "class|typename|.")
                    && !TokenMatcher.match(closing.tokAt(-2), "=|::")) {
                templateParameters.add(closing.strAt(-1));
            }
        }
        return null;
    }

    /**
     * The {@code <} opening the template argument list closed by {@code tok}.
     */
    public static @Nullable Token findOpeningBracket(Token tok) {
        if (tok == null || !tok.str().equals(">")) {
            return null;
        }
        int depth = 0;
        for (Token opening = tok; opening != null; opening = opening.previous()) {
            if (TokenMatcher.match(opening, "}|]|)")) {
                opening = opening.link();
                if (opening == null) {
                    return null;
                }
            } else if (TokenMatcher.match(opening, "{|(|;")) {
                return null;
            } else if (opening.str().equals(">")) {
                ++depth;
            } else if (opening.str().equals("<")) {
                if (--depth == 0) {
                    return opening;
                }
            }
        }
        return null;
    }

    private static Token goToLeftParenthesis(Token start, Token end) {
        int par = 0;
        for (Token tok = start; tok != null && tok != end; tok = tok.next()) {
            if (tok.str().equals("(")) {
                ++par;
            } else if (tok.str().equals(")")) {
                if (par == 0) {
                    start = tok.link();
                } else {
                    --par;
                }
            }
        }
        return start;
    }

    private static Token goToRightParenthesis(Token start, Token end) {
        int par = 0;
        for (Token tok = end; tok != null && tok != start; tok = tok.previous()) {
            if (tok.str().equals(")")) {
                ++par;
            } else if (tok.str().equals("(")) {
                if (par == 0) {
                    end = tok.link();
                } else {
                    --par;
                }
            }
        }
        return end;
    }

    /**
     * A parenthesis that only groups, without a role in the expression tree.
     */
    private static boolean isGroupingParenthesis(Token open) {
        return open != null && open.str().equals("(") && open.link() != null
                && open.astOperand1() == null && open.astOperand2() == null && open.astParent() == null;
    }

    /**
     * The first and last token of the source text of the expression rooted at {@code top}.
     *
     * @throws InternalAnalysisException when the derived range does not enclose {@code top}
     */
    public static TokenRange findExpressionStartEndTokens(Token top) {
        Token start = top;
        while (start.astOperand1() != null && precedes(start.astOperand1(), start)) {
            start = start.astOperand1();
        }

        Token end = top;
        while (end.astOperand1() != null && (end.astOperand2() != null || isUnaryPreOp(end))) {
            if (end.str().equals("[")) {
                Token lambdaEnd = findLambdaEndToken(end);
                if (lambdaEnd != null) {
                    end = lambdaEnd;
                    break;
                }
            }
            if (TokenMatcher.match(end, "(|[|{")
                    && !(TokenMatcher.match(end, "( ::| %type%") && end.astOperand2() == null)) {
                end = end.link();
                break;
            }
            end = end.astOperand2() != null ? end.astOperand2() : end.astOperand1();
        }

        start = goToLeftParenthesis(start, end);
        end = goToRightParenthesis(start, end);
        if (TokenMatcher.simpleMatch(end, "{")) {
            end = end.link();
        }
        while (start != null && end != null && isGroupingParenthesis(start.previous())
                && start.previous().link() == end.next()) {
            start = start.previous();
            end = end.next();
        }

        if (start == null || precedes(top, start)) {
            throw new InternalAnalysisException(start == null ? top : start, "Cannot find start of expression",
                    InternalErrorType.AST);
        }
        if (end == null || succeeds(top, end)) {
            throw new InternalAnalysisException(end == null ? top : end, "Cannot find end of expression",
                    InternalErrorType.AST);
        }
        return new TokenRange(start, end);
    }

    /**
     * Source-like text of the expression rooted at {@code tok}.
     */
    public static String expressionString(Token tok) {
        TokenRange range = findExpressionStartEndTokens(tok);
        return stringFromTokenRange(range.start(), range.end());
    }

    static String stringFromTokenRange(Token start, Token end) {
        StringBuilder ret = new StringBuilder();
        Token stop = end == null ? null : end.next();
        for (Token tok = start; tok != null && tok != stop; tok = tok.next()) {
            if (tok.isUnsigned()) {
                ret.append("unsigned ");
            }
            if (tok.isLong() && !tok.isLiteral()) {
                ret.append("long ");
            }
            if (tok.kind() == TokenKind.STRING) {
                for (char c : tok.str().toCharArray()) {
                    if (c == '\n') {
                        ret.append("\\n");
                    } else if (c == '\r') {
                        ret.append("\\r");
                    } else if (c == '\t') {
                        ret.append("\\t");
                    } else if (c >= ' ' && c <= 126) {
                        ret.append(c);
                    } else {
                        ret.append(String.format("\\x%02x", c & 0xFF));
                    }
                }
            } else if (tok.originalName().isEmpty() || tok.isUnsigned() || tok.isLong()) {
                ret.append(tok.str());
            } else {
                ret.append(tok.originalName());
            }
            if (TokenMatcher.match(tok, "%name%|%num% %name%|%num%")) {
                ret.append(' ');
            }
        }
        return ret.toString();
    }

    /**
     * Whether {@code tok} computes a value. For {@code *} and {@code &} the
     * operand tree must contain a number or a variable; otherwise the token
     * is taken to be a pointer or reference declarator.
     */
    public static boolean isCalculation(Token tok) {
        if (!TokenMatcher.match(tok, "%cop%|++|--")) {
            return false;
        }
        if (!TokenMatcher.match(tok, "*|&")) {
            return true;
        }
        if (tok.astOperand2() == null || tok.astOperand2().str().equals("[")) {
            return false;
        }
        Deque<Token> operands = new ArrayDeque<>();
        operands.push(tok);
        while (!operands.isEmpty()) {
            Token op = operands.pop();
            if (op.isNumber() || op.varId() > 0) {
                return true;
            }
            if (op.astOperand1() != null) {
                operands.push(op.astOperand1());
            }
            if (op.astOperand2() != null) {
                operands.push(op.astOperand2());
            } else if (TokenMatcher.match(op, "*|&")) {
                return false;
            }
        }
        return false;
    }

    /**
     * Whether {@code tok} is a prefix unary operator. For {@code ++} and
     * {@code --} the side on which the operand appears first, within
     * {@value #PRE_OP_SCAN_DISTANCE} tokens, decides; beyond that the answer is false.
     */
    public static boolean isUnaryPreOp(Token tok) {
        if (tok.astOperand1() == null || tok.astOperand2() != null) {
            return false;
        }
        if (tok.kind() != TokenKind.INC_DEC_OP) {
            return true;
        }
        Token operand = tok.astOperand1();
        Token before = tok.previous();
        Token after = tok.next();
        for (int distance = 1; distance < PRE_OP_SCAN_DISTANCE && before != null; distance++) {
            if (before == operand) {
                return false;
            }
            if (after == operand) {
                return true;
            }
            before = before.previous();
            after = after == null ? null : after.next();
        }
        return false;
    }

    /**
     * The first token of the argument following the one {@code tok} is in.
     */
    public static @Nullable Token nextArgument(Token tok) {
        for (Token t = tok; t != null; t = t.next()) {
            if (t.str().equals(",")) {
                return t.next();
            }
            if (t.link() != null && TokenMatcher.match(t, "(|{|[|<")) {
                t = t.link();
            } else if (TokenMatcher.match(t, ")|;")) {
                return null;
            }
        }
        return null;
    }

    /**
     * Like {@link #nextArgument(Token)} for sequences whose template
     * brackets are not linked yet.
     */
    public static @Nullable Token nextArgumentBeforeCreateLinks2(Token tok) {
        for (Token t = tok; t != null; t = t.next()) {
            if (t.str().equals(",")) {
                return t.next();
            }
            if (t.link() != null && TokenMatcher.match(t, "(|{|[")) {
                t = t.link();
            } else if (t.str().equals("<")) {
                Token closing = findClosingBracket(t);
                if (closing != null) {
                    t = closing;
                }
            } else if (TokenMatcher.match(t, ")|;")) {
                return null;
            }
        }
        return null;
    }

    public static @Nullable Token nextTemplateArgument(Token tok) {
        for (Token t = tok; t != null; t = t.next()) {
            if (t.str().equals(",")) {
                return t.next();
            }
            if (t.link() != null && TokenMatcher.match(t, "(|{|[|<")) {
                t = t.link();
            } else if (TokenMatcher.match(t, ">|;")) {
                return null;
            }
        }
        return null;
    }

    /**
     * The closing brace of the lambda whose capture list starts at {@code first}.
     */
    public static @Nullable Token findLambdaEndToken(Token first) {
        if (first == null || first.astOperand1() == null || !first.str().equals("[")) {
            return null;
        }
        if (!TokenMatcher.match(first.link(), "] (|{|<")) {
            return null;
        }
        Token roundOrCurly = first.link().next();
        if (roundOrCurly.link() != null && roundOrCurly.str().equals("<")) {
            roundOrCurly = roundOrCurly.link().next();
        }
        if (first.astOperand1() != roundOrCurly) {
            return null;
        }
        Token tok = first;
        if (tok.astOperand1() != null && tok.astOperand1().str().equals("(")) {
            tok = tok.astOperand1();
        }
        if (tok.astOperand1() != null && tok.astOperand1().str().equals("{")) {
            return tok.astOperand1().link();
        }
        return null;
    }

    /**
     * The closing brace of a lambda body, found from the tokens alone.
     */
    public static @Nullable Token findLambdaEndScope(Token tok) {
        if (!TokenMatcher.simpleMatch(tok, "[")) {
            return null;
        }
        tok = tok.link();
        if (!TokenMatcher.match(tok, "] (|{")) {
            return null;
        }
        tok = tok.linkAt(1);
        if (TokenMatcher.simpleMatch(tok, "}")) {
            return tok;
        }
        if (TokenMatcher.simpleMatch(tok, ") {")) {
            return tok.linkAt(1);
        }
        if (!TokenMatcher.simpleMatch(tok, ")")) {
            return null;
        }
        tok = tok.next();
        while (TokenMatcher.match(tok, "mutable|constexpr|consteval|noexcept|.")) {
            if (TokenMatcher.simpleMatch(tok, "noexcept (")) {
                tok = tok.linkAt(1);
            }
            if (TokenMatcher.simpleMatch(tok, ".")) {
                tok = findTypeEnd(tok);
                break;
            }
            tok = tok.next();
        }
        if (TokenMatcher.simpleMatch(tok, "{")) {
            return tok.link();
        }
        return null;
    }

    /**
     * The first token after a type expression starting at {@code tok}.
     */
    public static @Nullable Token findTypeEnd(Token tok) {
        while (TokenMatcher.match(tok, "%name%|.|::|*|&|&&|<|(|template|decltype|sizeof")) {
            if (TokenMatcher.match(tok, "(|<")) {
                tok = tok.link();
            }
            if (tok == null) {
                return null;
            }
            tok = tok.next();
        }
        return tok;
    }
}
