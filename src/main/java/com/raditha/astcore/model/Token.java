package com.raditha.astcore.model;

import com.raditha.astcore.ast.AstNavigator;
import com.raditha.astcore.ast.TokenRange;
import com.raditha.astcore.config.AnalysisConfig;
import com.raditha.astcore.dump.StringifyOptions;
import com.raditha.astcore.dump.TokenPrinter;
import com.raditha.astcore.error.InternalAnalysisException;
import com.raditha.astcore.error.InternalErrorType;
import com.raditha.astcore.match.TokenMatcher;
import com.raditha.astcore.symbols.ArgumentValidityOracle;
import com.raditha.astcore.symbols.FunctionSymbol;
import com.raditha.astcore.symbols.TypeSymbol;
import com.raditha.astcore.symbols.VariableSymbol;
import com.raditha.astcore.util.Literals;
import com.raditha.astcore.valueflow.Value;
import com.raditha.astcore.valueflow.ValueList;
import com.raditha.astcore.valueflow.ValueType;
import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.OptionalLong;
import java.util.Set;

/**
 * One lexical unit of the analysed source with its derived metadata.
 * <p>
 * Tokens form a doubly linked sequence owned by a {@link TokenList}. On top
 * of the sequence a token carries a bracket partner ({@link #link()}), the
 * edges of the expression tree and the dataflow facts computed for it.
 * <p>
 * Structural mutations keep the graph consistent: a removed token is
 * detached from its neighbours, its bracket partner and its AST relatives,
 * so no surviving token refers to it.
 */
public class Token {

    private static final int UNIQUE_EXPR_ID = 1 << 30;

    private static final Set<String> CONTROL_FLOW_KEYWORDS = Set.of(
            "goto", "do", "if", "else", "for", "while", "switch", "case", "break", "continue", "return");

    private static final Set<String> STANDARD_TYPES = Set.of(
            "bool", "_Bool", "char", "double", "float", "int", "long", "short", "size_t", "void",
            "wchar_t", "signed", "unsigned");

    private static final String QUALIFIERS = "const|volatile|final|override|&|&&|noexcept";

    private final TokenList list;
    private final TokensFrontBack frontBack;

    private String str = "";
    private TokenKind kind = TokenKind.NONE;
    private EnumSet<TokenFlag> flags = EnumSet.noneOf(TokenFlag.class);

    private Token next;
    private Token previous;
    private Token link;

    private TokenData data = new TokenData();

    Token(TokenList list, TokensFrontBack frontBack) {
        this.list = list;
        this.frontBack = frontBack;
    }

    public TokenList list() {
        return list;
    }

    // ------------------------------------------------------------------
    // text and classification

    public String str() {
        return str;
    }

    /**
     * Replace the text, reset the varId and classify the token again.
     */
    public void setStr(String s) {
        this.str = s == null ? "" : s;
        data.varId = 0;
        updatePropertyInfo();
    }

    public TokenKind kind() {
        return kind;
    }

    public void setKind(TokenKind kind) {
        this.kind = kind;
    }

    private void updatePropertyInfo() {
        flags.remove(TokenFlag.CONTROL_FLOW_KEYWORD);
        flags.remove(TokenFlag.STANDARD_TYPE);

        if (str.isEmpty()) {
            kind = TokenKind.NONE;
            return;
        }
        if (str.equals("true") || str.equals("false")) {
            if (data.varId != 0) {
                if (list.isCPP()) {
                    throw new InternalAnalysisException(this, "Internal error. VarId set for bool literal.");
                }
                kind = TokenKind.VARIABLE;
            } else {
                kind = TokenKind.BOOLEAN;
            }
        } else if (Literals.isStringLiteral(str)) {
            kind = TokenKind.STRING;
            setFlag(TokenFlag.LONG, Literals.isPrefixStringCharLiteral(str, '"', "L"));
        } else if (Literals.isCharLiteral(str)) {
            kind = TokenKind.CHAR;
            setFlag(TokenFlag.LONG, Literals.isPrefixStringCharLiteral(str, '\'', "L"));
        } else if (isNameStart(str.charAt(0))) {
            if (data.varId != 0) {
                kind = TokenKind.VARIABLE;
            } else if (list.isKeyword(str)) {
                kind = TokenKind.KEYWORD;
                updateStandardType();
                if (kind != TokenKind.TYPE) {
                    setFlag(TokenFlag.CONTROL_FLOW_KEYWORD, CONTROL_FLOW_KEYWORDS.contains(str));
                }
            } else if (str.equals("asm")) {
                kind = TokenKind.KEYWORD;
            } else {
                kind = TokenKind.NAME;
                updateStandardType();
            }
        } else if (Literals.isNumberLike(str)) {
            if ((Literals.isInt(str) || Literals.isFloat(str)) && str.indexOf('_') < 0) {
                kind = TokenKind.NUMBER;
            } else {
                kind = TokenKind.NAME;
            }
        } else if (str.equals("=") || str.equals("<<=") || str.equals(">>=")
                || (str.length() == 2 && str.charAt(1) == '=' && "+-*/%&^|".indexOf(str.charAt(0)) >= 0)) {
            kind = TokenKind.ASSIGNMENT_OP;
        } else if (str.length() == 1 && ",[]()?:".indexOf(str.charAt(0)) >= 0) {
            kind = TokenKind.EXTENDED_OP;
        } else if (str.equals("<<") || str.equals(">>")
                || (str.length() == 1 && "+-*/%".indexOf(str.charAt(0)) >= 0)) {
            kind = TokenKind.ARITHMETICAL_OP;
        } else if (str.length() == 1 && "&|^~".indexOf(str.charAt(0)) >= 0) {
            kind = TokenKind.BIT_OP;
        } else if (str.equals("&&") || str.equals("||") || str.equals("!")) {
            kind = TokenKind.LOGICAL_OP;
        } else if (link == null && (str.equals("==") || str.equals("!=") || str.equals("<")
                || str.equals("<=") || str.equals(">") || str.equals(">="))) {
            kind = TokenKind.COMPARISON_OP;
        } else if (str.equals("<=>")) {
            kind = TokenKind.COMPARISON_OP;
        } else if (str.equals("++") || str.equals("--")) {
            kind = TokenKind.INC_DEC_OP;
        } else if (str.length() == 1 && ("{}".indexOf(str.charAt(0)) >= 0
                || (link != null && "<>".indexOf(str.charAt(0)) >= 0))) {
            kind = TokenKind.BRACKET;
        } else if (str.equals("...")) {
            kind = TokenKind.ELLIPSIS;
        } else {
            kind = TokenKind.OTHER;
        }
    }

    private static boolean isNameStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$';
    }

    private void updateStandardType() {
        if (str.length() < 3 || str.length() > 7) {
            return;
        }
        if (isStandardType(str)) {
            flags.add(TokenFlag.STANDARD_TYPE);
            kind = TokenKind.TYPE;
        }
    }

    public static boolean isStandardType(String s) {
        return STANDARD_TYPES.contains(s);
    }

    public boolean isName() {
        return kind.isName();
    }

    public boolean isLiteral() {
        return kind.isLiteral();
    }

    public boolean isKeyword() {
        return kind == TokenKind.KEYWORD;
    }

    public boolean isNumber() {
        return kind == TokenKind.NUMBER;
    }

    public boolean isBoolean() {
        return kind == TokenKind.BOOLEAN;
    }

    public boolean isArithmeticalOp() {
        return kind == TokenKind.ARITHMETICAL_OP;
    }

    public boolean isComparisonOp() {
        return kind == TokenKind.COMPARISON_OP;
    }

    public boolean isAssignmentOp() {
        return kind == TokenKind.ASSIGNMENT_OP;
    }

    public boolean isIncDecOp() {
        return kind == TokenKind.INC_DEC_OP;
    }

    /**
     * Operators that compute a value without side effects.
     */
    public boolean isConstOp() {
        return kind == TokenKind.ARITHMETICAL_OP || kind == TokenKind.LOGICAL_OP
                || kind == TokenKind.COMPARISON_OP || kind == TokenKind.BIT_OP;
    }

    public boolean isExtendedOp() {
        return isConstOp() || kind == TokenKind.EXTENDED_OP;
    }

    public boolean isOp() {
        return isConstOp() || kind == TokenKind.ASSIGNMENT_OP || kind == TokenKind.INC_DEC_OP;
    }

    /**
     * A name without lower case letters, typical for macros and constants.
     */
    public boolean isUpperCaseName() {
        if (!isName()) {
            return false;
        }
        for (int i = 0; i < str.length(); i++) {
            if (Character.isLowerCase(str.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * A plain string literal, or a plain character literal holding exactly one character.
     */
    public boolean isCChar() {
        return (kind == TokenKind.STRING && Literals.isPrefixStringCharLiteral(str, '"', ""))
                || (kind == TokenKind.CHAR && Literals.isPrefixStringCharLiteral(str, '\'', "")
                && Literals.replaceEscapeSequences(Literals.getCharLiteral(str)).length() == 1);
    }

    /**
     * Append the content of string literal {@code b} to this string literal.
     */
    public void concatStr(String b) {
        str = str.substring(0, str.length() - 1) + Literals.getStringLiteral(b) + "\"";
        if (isCChar() && Literals.isStringLiteral(b) && b.charAt(0) != '"') {
            str = b.substring(0, b.indexOf('"')) + str;
        }
        updatePropertyInfo();
    }

    /**
     * The content of a string literal with simple escapes resolved, cut at
     * the first embedded NUL.
     */
    public String strValue() {
        if (kind != TokenKind.STRING) {
            throw new InternalAnalysisException(this, "Internal error. strValue() called on a non-string token.");
        }
        StringBuilder ret = new StringBuilder(Literals.getStringLiteral(str));
        int pos = 0;
        while ((pos = ret.indexOf("\\", pos)) >= 0) {
            ret.deleteCharAt(pos);
            if (pos >= ret.length()) {
                break;
            }
            char c = ret.charAt(pos);
            if (c == 'n') {
                ret.setCharAt(pos, '\n');
            } else if (c == 'r') {
                ret.setCharAt(pos, '\r');
            } else if (c == 't') {
                ret.setCharAt(pos, '\t');
            }
            if (ret.charAt(pos) == '0') {
                return ret.substring(0, pos);
            }
            pos++;
        }
        return ret.toString();
    }

    // ------------------------------------------------------------------
    // flags

    public boolean isFlag(TokenFlag flag) {
        return flags.contains(flag);
    }

    public void setFlag(TokenFlag flag, boolean state) {
        if (state) {
            flags.add(flag);
        } else {
            flags.remove(flag);
        }
    }

    public Set<TokenFlag> flags() {
        return Collections.unmodifiableSet(flags);
    }

    public boolean isUnsigned() {
        return isFlag(TokenFlag.UNSIGNED);
    }

    public void setUnsigned(boolean state) {
        setFlag(TokenFlag.UNSIGNED, state);
    }

    public boolean isSigned() {
        return isFlag(TokenFlag.SIGNED);
    }

    public void setSigned(boolean state) {
        setFlag(TokenFlag.SIGNED, state);
    }

    public boolean isLong() {
        return isFlag(TokenFlag.LONG);
    }

    public void setLong(boolean state) {
        setFlag(TokenFlag.LONG, state);
    }

    public boolean isComplex() {
        return isFlag(TokenFlag.COMPLEX);
    }

    public boolean isStandardType() {
        return isFlag(TokenFlag.STANDARD_TYPE);
    }

    public boolean isControlFlowKeyword() {
        return isFlag(TokenFlag.CONTROL_FLOW_KEYWORD);
    }

    public boolean isExpandedMacro() {
        return isFlag(TokenFlag.EXPANDED_MACRO);
    }

    public boolean isEnumType() {
        return isFlag(TokenFlag.ENUM_TYPE);
    }

    // ------------------------------------------------------------------
    // sequence navigation

    public @Nullable Token next() {
        return next;
    }

    public @Nullable Token previous() {
        return previous;
    }

    /**
     * The token {@code index} positions away, negative for backwards, or null.
     */
    public @Nullable Token tokAt(int index) {
        Token tok = this;
        while (index > 0 && tok != null) {
            tok = tok.next;
            index--;
        }
        while (index < 0 && tok != null) {
            tok = tok.previous;
            index++;
        }
        return tok;
    }

    /**
     * The link of the token {@code index} positions away.
     *
     * @throws InternalAnalysisException when that position is outside the sequence
     */
    public @Nullable Token linkAt(int index) {
        Token tok = tokAt(index);
        if (tok == null) {
            throw new InternalAnalysisException(this,
                    "Internal error. Token::linkAt called with index outside the tokens range.");
        }
        return tok.link;
    }

    /**
     * Text of the token {@code index} positions away, "" outside the sequence.
     */
    public String strAt(int index) {
        Token tok = tokAt(index);
        return tok == null ? "" : tok.str;
    }

    /**
     * The tokens from this one up to, but not including, {@code end}.
     * A null end iterates to the end of the sequence.
     */
    public Iterable<Token> until(@Nullable Token end) {
        Token start = this;
        return () -> new Iterator<>() {
            private Token current = start;

            @Override
            public boolean hasNext() {
                return current != null && current != end;
            }

            @Override
            public Token next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Token result = current;
                current = current.next;
                return result;
            }
        };
    }

    // ------------------------------------------------------------------
    // links

    public @Nullable Token link() {
        return link;
    }

    /**
     * Set one side of a bracket pairing. Angle brackets are reclassified
     * since a linked {@code <} is a bracket rather than a comparison.
     * Use {@link #createMutualLinks(Token, Token)} to pair two tokens.
     */
    public void setLink(@Nullable Token linkTo) {
        this.link = linkTo;
        if (str.equals("<") || str.equals(">")) {
            updatePropertyInfo();
        }
    }

    /**
     * Pair two bracket tokens with each other.
     *
     * @throws InternalAnalysisException when either token is null or both are the same
     */
    public static void createMutualLinks(Token begin, Token end) {
        if (begin == null || end == null || begin == end) {
            throw new InternalAnalysisException(begin != null ? begin : end,
                    "Internal error. Malformed link request.", InternalErrorType.SYNTAX);
        }
        begin.setLink(end);
        end.setLink(begin);
    }

    // ------------------------------------------------------------------
    // position and identity

    public int fileIndex() {
        return data.fileIndex;
    }

    public void setFileIndex(int fileIndex) {
        data.fileIndex = fileIndex;
    }

    public int lineNumber() {
        return data.lineNumber;
    }

    public void setLineNumber(int lineNumber) {
        data.lineNumber = lineNumber;
    }

    public int column() {
        return data.column;
    }

    public void setColumn(int column) {
        data.column = column;
    }

    /**
     * Position in the sequence as of the last {@link #assignIndexes()}.
     */
    public int index() {
        return data.index;
    }

    /**
     * Relative position in percent, used for progress reporting.
     */
    public int progressValue() {
        return data.progressValue;
    }

    public int varId() {
        return data.varId;
    }

    public void setVarId(int id) {
        data.varId = id;
        if (id != 0) {
            if (str.equals("true") || str.equals("false")) {
                updatePropertyInfo();
                return;
            }
            kind = TokenKind.VARIABLE;
            flags.remove(TokenFlag.STANDARD_TYPE);
        } else {
            updatePropertyInfo();
        }
    }

    /**
     * Identity of the expression rooted here; falls back to the varId.
     */
    public int exprId() {
        if (data.exprId != 0) {
            return data.exprId;
        }
        return data.varId;
    }

    public void setExprId(int id) {
        data.exprId = id;
    }

    public void setUniqueExprId() {
        data.exprId |= UNIQUE_EXPR_ID;
    }

    public boolean isUniqueExprId() {
        return (data.exprId & UNIQUE_EXPR_ID) != 0;
    }

    public String originalName() {
        return data.originalName;
    }

    public void setOriginalName(String name) {
        data.originalName = name == null ? "" : name;
    }

    public String macroName() {
        return data.macroName;
    }

    /**
     * Record the macro this token was expanded from; a non-empty name marks
     * the token as {@link TokenFlag#EXPANDED_MACRO}.
     */
    public void setMacroName(String name) {
        data.macroName = name == null ? "" : name;
        setFlag(TokenFlag.EXPANDED_MACRO, !data.macroName.isEmpty());
    }

    public @Nullable ScopeInfo scopeInfo() {
        return data.scopeInfo;
    }

    public void setScopeInfo(@Nullable ScopeInfo scopeInfo) {
        data.scopeInfo = scopeInfo;
    }

    public OptionalLong rangeAttribute(RangeAttribute attribute) {
        if (data.rangeAttributes == null || !data.rangeAttributes.containsKey(attribute)) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(data.rangeAttributes.get(attribute));
    }

    public void setRangeAttribute(RangeAttribute attribute, long value) {
        if (data.rangeAttributes == null) {
            data.rangeAttributes = new EnumMap<>(RangeAttribute.class);
        }
        data.rangeAttributes.put(attribute, value);
    }

    void addTemplateSimplifierPointer(TemplateSimplifierPointer pointer) {
        data.templateSimplifierPointers().add(pointer);
    }

    public List<TemplateSimplifierPointer> templateSimplifierPointers() {
        if (data.templateSimplifierPointers == null) {
            return List.of();
        }
        return Collections.unmodifiableList(data.templateSimplifierPointers);
    }

    // ------------------------------------------------------------------
    // symbols

    public @Nullable VariableSymbol variable() {
        return data.variable;
    }

    public void setVariable(@Nullable VariableSymbol variable) {
        data.variable = variable;
        if (variable != null || data.varId != 0) {
            kind = TokenKind.VARIABLE;
        } else if (kind == TokenKind.VARIABLE) {
            kind = TokenKind.NAME;
        }
    }

    public @Nullable FunctionSymbol function() {
        return data.function;
    }

    public void setFunction(@Nullable FunctionSymbol function) {
        data.function = function;
        if (function != null) {
            kind = function.isLambda() ? TokenKind.LAMBDA : TokenKind.FUNCTION;
        } else if (kind == TokenKind.FUNCTION) {
            kind = TokenKind.NAME;
        }
    }

    public @Nullable TypeSymbol type() {
        return data.type;
    }

    public void setType(@Nullable TypeSymbol type) {
        data.type = type;
        if (type != null) {
            kind = TokenKind.TYPE;
            setFlag(TokenFlag.ENUM_TYPE, type.isEnumType());
        } else if (kind == TokenKind.TYPE) {
            kind = TokenKind.NAME;
        }
    }

    // ------------------------------------------------------------------
    // expression tree

    public @Nullable Token astOperand1() {
        return data.astOperand1;
    }

    public @Nullable Token astOperand2() {
        return data.astOperand2;
    }

    public @Nullable Token astParent() {
        return data.astParent;
    }

    /**
     * Attach the tree containing {@code tok} as first operand. The previous
     * operand loses its parent.
     */
    public void setAstOperand1(@Nullable Token tok) {
        if (data.astOperand1 != null) {
            data.astOperand1.setAstParent(null);
        }
        if (tok != null) {
            tok = tok.astTop();
            tok.setAstParent(this);
        }
        data.astOperand1 = tok;
    }

    public void setAstOperand2(@Nullable Token tok) {
        if (data.astOperand2 != null) {
            data.astOperand2.setAstParent(null);
        }
        if (tok != null) {
            tok = tok.astTop();
            tok.setAstParent(this);
        }
        data.astOperand2 = tok;
    }

    /**
     * Set the parent, removing this token from its old parent's operands.
     *
     * @throws InternalAnalysisException when the new parent is this token or one of its descendants
     */
    public void setAstParent(@Nullable Token tok) {
        for (Token t = tok; t != null; t = t.data.astParent) {
            if (t == this) {
                throw new InternalAnalysisException(this, "Internal error. AST cyclic dependency.",
                        InternalErrorType.AST);
            }
        }
        Token parent = data.astParent;
        if (parent != null) {
            if (parent.data.astOperand1 == this) {
                parent.data.astOperand1 = null;
            }
            if (parent.data.astOperand2 == this) {
                parent.data.astOperand2 = null;
            }
        }
        data.astParent = tok;
    }

    public Token astTop() {
        Token ret = this;
        while (ret.data.astParent != null) {
            ret = ret.data.astParent;
        }
        return ret;
    }

    /**
     * The other operand of this token's parent.
     */
    public @Nullable Token astSibling() {
        Token parent = data.astParent;
        if (parent == null) {
            return null;
        }
        if (parent.data.astOperand1 == this) {
            return parent.data.astOperand2;
        }
        if (parent.data.astOperand2 == this) {
            return parent.data.astOperand1;
        }
        return null;
    }

    public boolean isUnaryOp(String s) {
        return s.equals(str) && data.astOperand1 != null && data.astOperand2 == null;
    }

    public boolean isBinaryOp() {
        return data.astOperand1 != null && data.astOperand2 != null;
    }

    /**
     * Drop the tree edges stored on this token without touching its relatives.
     */
    public void clearAst() {
        data.astOperand1 = null;
        data.astOperand2 = null;
        data.astParent = null;
    }

    public @Nullable Token findClosingBracket() {
        return AstNavigator.findClosingBracket(this);
    }

    public @Nullable Token findOpeningBracket() {
        return AstNavigator.findOpeningBracket(this);
    }

    public TokenRange findExpressionStartEndTokens() {
        return AstNavigator.findExpressionStartEndTokens(this);
    }

    public String expressionString() {
        return AstNavigator.expressionString(this);
    }

    public boolean isCalculation() {
        return AstNavigator.isCalculation(this);
    }

    public boolean isUnaryPreOp() {
        return AstNavigator.isUnaryPreOp(this);
    }

    public @Nullable Token nextArgument() {
        return AstNavigator.nextArgument(this);
    }

    // ------------------------------------------------------------------
    // dataflow facts

    /**
     * The facts attached to this token, empty when there are none.
     */
    public List<Value> values() {
        return data.values == null ? List.of() : data.values.asList();
    }

    /**
     * Add a fact, keeping the fact list consistent.
     *
     * @return false when the fact was rejected as redundant, contradicted or over the cap
     */
    public boolean addValue(Value value) {
        if (data.values == null) {
            data.values = new ValueList();
        }
        return data.values.add(value, data.varId);
    }

    public void clearValueFlow() {
        data.values = null;
    }

    private ValueList valueList() {
        return data.values == null ? new ValueList() : data.values;
    }

    public boolean hasKnownIntValue() {
        return data.values != null && data.values.hasKnownIntValue();
    }

    public boolean hasKnownValue() {
        return data.values != null && data.values.hasKnownValue();
    }

    public boolean hasKnownValue(ValueType type) {
        return data.values != null && data.values.hasKnownValue(type);
    }

    public boolean hasKnownSymbolicValue(Token tok) {
        return data.values != null && data.values.hasKnownSymbolicValue(tok);
    }

    public @Nullable Value getKnownValue(ValueType type) {
        return valueList().getKnownValue(type);
    }

    /**
     * The known integer value.
     *
     * @throws InternalAnalysisException when the token has no known integer fact
     */
    public long getKnownIntValue() {
        if (!hasKnownIntValue()) {
            throw new InternalAnalysisException(this, "Internal error. Token has no known integer value.");
        }
        return data.values.first().getIntValue();
    }

    public @Nullable Value getValue(long val) {
        return valueList().getValue(val);
    }

    public @Nullable Value getValueLE(long val, AnalysisConfig settings) {
        return valueList().getValueLE(val, settings);
    }

    public @Nullable Value getValueGE(long val, AnalysisConfig settings) {
        return valueList().getValueGE(val, settings);
    }

    public @Nullable Value getValueNE(long val) {
        return valueList().getValueNE(val);
    }

    public @Nullable Value getInvalidValue(Token ftok, int argnr, AnalysisConfig settings,
                                           ArgumentValidityOracle oracle) {
        return valueList().getInvalidValue(ftok, argnr, settings, oracle);
    }

    public @Nullable Value getMinValue(boolean condition, long path) {
        return valueList().getMinValue(condition, path);
    }

    public @Nullable Value getMaxValue(boolean condition, long path) {
        return valueList().getMaxValue(condition, path);
    }

    public @Nullable Value getMovedValue() {
        return valueList().getMovedValue();
    }

    public @Nullable Value getContainerSizeValue(long val) {
        return valueList().getContainerSizeValue(val);
    }

    /**
     * The string literal among the token facts with the smallest storage size.
     */
    public @Nullable Token getValueTokenMinStrSize(AnalysisConfig settings) {
        Value v = valueList().getValueTokenMinStrSize(settings);
        return v == null ? null : v.getTokValue();
    }

    public @Nullable Token getValueTokenMaxStrLength() {
        Value v = valueList().getValueTokenMaxStrLength();
        return v == null ? null : v.getTokValue();
    }

    private static void requireString(Token tok) {
        if (tok == null || tok.kind != TokenKind.STRING) {
            throw new InternalAnalysisException(tok, "Internal error. String literal expected.");
        }
    }

    /**
     * Number of characters before the first NUL of a string literal.
     */
    public static int getStrLength(Token tok) {
        requireString(tok);
        String s = Literals.replaceEscapeSequences(Literals.getStringLiteral(tok.str));
        int pos = s.indexOf('\0');
        return pos >= 0 ? pos : s.length();
    }

    /**
     * Number of characters of a string literal including the terminating NUL.
     */
    public static int getStrArraySize(Token tok) {
        requireString(tok);
        String s = Literals.getStringLiteral(tok.str);
        int size = 1;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == '\\') {
                ++i;
            }
            ++size;
        }
        return size;
    }

    /**
     * Storage size in bytes of a string literal.
     */
    public static int getStrSize(Token tok, AnalysisConfig settings) {
        requireString(tok);
        int charSize;
        if (tok.str.startsWith("L")) {
            charSize = settings.sizeofWchar();
        } else if (tok.str.startsWith("u8")) {
            charSize = 1;
        } else if (tok.str.startsWith("u")) {
            charSize = 2;
        } else if (tok.str.startsWith("U")) {
            charSize = 4;
        } else {
            charSize = 1;
        }
        return getStrArraySize(tok) * charSize;
    }

    // ------------------------------------------------------------------
    // structural mutation

    public Token insertToken(String tokenStr) {
        return insertToken(tokenStr, "", "", false);
    }

    public Token insertTokenBefore(String tokenStr) {
        return insertToken(tokenStr, "", "", true);
    }

    /**
     * Insert a token after (or, with {@code prepend}, before) this one.
     * An empty receiver is reused instead. The new token copies the file,
     * line and progress of the receiver and, when scopes are tracked,
     * inherits or opens a scope.
     *
     * @return the inserted token
     */
    public Token insertToken(String tokenStr, String originalNameStr, String macroNameStr, boolean prepend) {
        Token newToken = str.isEmpty() ? this : new Token(list, frontBack);
        newToken.setStr(tokenStr);
        if (originalNameStr != null && !originalNameStr.isEmpty()) {
            newToken.setOriginalName(originalNameStr);
        }
        if (macroNameStr != null && !macroNameStr.isEmpty()) {
            newToken.setMacroName(macroNameStr);
        }

        if (newToken != this) {
            newToken.data.lineNumber = data.lineNumber;
            newToken.data.fileIndex = data.fileIndex;
            newToken.data.progressValue = data.progressValue;

            if (prepend) {
                if (previous != null) {
                    newToken.previous = previous;
                    previous.next = newToken;
                } else {
                    frontBack.front = newToken;
                }
                previous = newToken;
                newToken.next = this;
            } else {
                if (next != null) {
                    newToken.next = next;
                    next.previous = newToken;
                } else {
                    frontBack.back = newToken;
                }
                next = newToken;
                newToken.previous = this;
            }

            if (data.scopeInfo != null) {
                trackScope(newToken, prepend);
            }
        }
        return newToken;
    }

    private void trackScope(Token newToken, boolean prepend) {
        if (newToken.str.equals("{")) {
            String addition = memberFunctionScope(newToken);
            if (addition == null) {
                return;
            }
            StringBuilder nextScopeNameAddition = new StringBuilder(addition);

            if (TokenMatcher.match(newToken.previous, "%name%|>")) {
                Token nameTok = newToken.previous;
                while (nameTok != null && !TokenMatcher.match(nameTok, "namespace|class|struct|union %name% {|::|:|<")) {
                    nameTok = nameTok.previous;
                }
                if (nameTok != null) {
                    for (nameTok = nameTok.next; nameTok != null && !TokenMatcher.match(nameTok, "{|:|<");
                         nameTok = nameTok.next) {
                        nextScopeNameAddition.append(nameTok.str).append(' ');
                    }
                    if (nextScopeNameAddition.length() > 0) {
                        nextScopeNameAddition.setLength(nextScopeNameAddition.length() - 1);
                    }
                }
            }

            String name = data.scopeInfo.name();
            if (!name.isEmpty() && nextScopeNameAddition.length() > 0) {
                name += " :: ";
            }
            name += nextScopeNameAddition;
            newToken.data.scopeInfo = new ScopeInfo(name, null, data.scopeInfo.usingNamespaces());
        } else if (newToken.str.equals("}")) {
            Token matchingTok = newToken.previous;
            int depth = 0;
            while (matchingTok != null && (depth != 0 || !matchingTok.str.equals("{"))) {
                if (matchingTok.str.equals("}")) {
                    depth++;
                }
                if (matchingTok.str.equals("{")) {
                    depth--;
                }
                matchingTok = matchingTok.previous;
            }
            if (matchingTok != null && matchingTok.previous != null) {
                newToken.data.scopeInfo = matchingTok.previous.data.scopeInfo;
            }
        } else {
            if (prepend && newToken.previous != null) {
                newToken.data.scopeInfo = newToken.previous.data.scopeInfo;
            } else {
                newToken.data.scopeInfo = data.scopeInfo;
            }
            if (newToken.str.equals(";")) {
                recordUsingNamespace(newToken);
            }
        }
    }

    /**
     * Qualifier of a member function body opened by {@code brace}, for
     * example {@code "A :: B"} for {@code void A::B::f() const {}}; "" when
     * the brace does not follow a qualified function header, null when the
     * header is malformed and no scope should be opened.
     */
    private static String memberFunctionScope(Token brace) {
        Token tok1 = brace;
        while (TokenMatcher.match(tok1.previous, QUALIFIERS)) {
            tok1 = tok1.previous;
        }
        if (tok1.previous == null || !tok1.strAt(-1).equals(")")) {
            return "";
        }
        tok1 = tok1.linkAt(-1);
        if (tok1 == null) {
            return "";
        }
        if (TokenMatcher.match(tok1.previous, "throw|noexcept")) {
            tok1 = tok1.previous;
            while (TokenMatcher.match(tok1.previous, QUALIFIERS)) {
                tok1 = tok1.previous;
            }
            if (!tok1.strAt(-1).equals(")")) {
                return null;
            }
        } else if (TokenMatcher.match(brace.tokAt(-2), ":|, %name%")) {
            tok1 = tok1.tokAt(-2);
            if (tok1 == null || !tok1.strAt(-1).equals(")")) {
                return null;
            }
        }
        if (tok1.strAt(-1).equals(">")) {
            tok1 = tok1.previous.findOpeningBracket();
        }
        if (tok1 != null && TokenMatcher.match(tok1.tokAt(-3), "%name% :: %name%")) {
            tok1 = tok1.tokAt(-2);
            String scope = tok1.strAt(-1);
            while (TokenMatcher.match(tok1.tokAt(-2), ":: %name%")) {
                scope = tok1.strAt(-3) + " :: " + scope;
                tok1 = tok1.tokAt(-2);
            }
            return scope;
        }
        return "";
    }

    private void recordUsingNamespace(Token semicolon) {
        Token statementStart = semicolon;
        while (statementStart.previous != null && !TokenMatcher.match(statementStart.previous, ";|{")) {
            statementStart = statementStart.previous;
        }
        if (TokenMatcher.match(statementStart, "using namespace %name% ::|;")) {
            StringBuilder nameSpace = new StringBuilder();
            for (Token tok1 = statementStart.tokAt(2); tok1 != null && !tok1.str.equals(";"); tok1 = tok1.next) {
                if (nameSpace.length() > 0) {
                    nameSpace.append(' ');
                }
                nameSpace.append(tok1.str);
            }
            data.scopeInfo.addUsingNamespace(nameSpace.toString());
        }
    }

    public void deleteNext() {
        deleteNext(1);
    }

    /**
     * Remove up to {@code count} tokens after this one.
     */
    public void deleteNext(int count) {
        while (next != null && count > 0) {
            Token n = next;
            next = n.next;
            n.detach();
            --count;
        }
        if (next != null) {
            next.previous = this;
        } else {
            frontBack.back = this;
        }
    }

    public void deletePrevious() {
        deletePrevious(1);
    }

    public void deletePrevious(int count) {
        while (previous != null && count > 0) {
            Token p = previous;
            previous = p.previous;
            p.detach();
            --count;
        }
        if (previous != null) {
            previous.next = this;
        } else {
            frontBack.front = this;
        }
    }

    /**
     * Remove this token from the sequence. The node itself survives with the
     * payload of its neighbour, which is removed instead; a lone token
     * becomes {@code ;}.
     */
    public void deleteThis() {
        if (next != null) {
            takeData(next);
            next.setLink(null);
            deleteNext();
        } else if (previous != null) {
            takeData(previous);
            previous.setLink(null);
            deletePrevious();
        } else {
            setStr(";");
        }
    }

    /**
     * Move text, classification, flags and payload of {@code from} into this
     * token. References to {@code from} held by its link partner, its AST
     * relatives and template bookkeeping are moved to this token.
     */
    private void takeData(Token from) {
        severRelations();
        str = from.str;
        kind = from.kind;
        flags = EnumSet.copyOf(from.flags);
        data = from.data;
        from.data = new TokenData();

        if (data.templateSimplifierPointers != null) {
            for (TemplateSimplifierPointer pointer : data.templateSimplifierPointers) {
                pointer.token(this);
            }
        }
        repointAst(from, this);
        link = from.link;
        if (link != null) {
            link.setLink(this);
        }
    }

    private void repointAst(Token from, Token to) {
        if (data.astOperand1 != null && data.astOperand1.data.astParent == from) {
            data.astOperand1.data.astParent = to;
        }
        if (data.astOperand2 != null && data.astOperand2.data.astParent == from) {
            data.astOperand2.data.astParent = to;
        }
        Token parent = data.astParent;
        if (parent != null) {
            if (parent.data.astOperand1 == from) {
                parent.data.astOperand1 = to;
            }
            if (parent.data.astOperand2 == from) {
                parent.data.astOperand2 = to;
            }
        }
    }

    /**
     * Exchange text, classification, flags and payload with the next token.
     */
    public void swapWithNext() {
        if (next == null) {
            return;
        }
        Token other = next;

        String tmpStr = str;
        str = other.str;
        other.str = tmpStr;

        TokenKind tmpKind = kind;
        kind = other.kind;
        other.kind = tmpKind;

        EnumSet<TokenFlag> tmpFlags = flags;
        flags = other.flags;
        other.flags = tmpFlags;

        TokenData tmpData = data;
        data = other.data;
        other.data = tmpData;

        if (data.templateSimplifierPointers != null) {
            for (TemplateSimplifierPointer pointer : data.templateSimplifierPointers) {
                pointer.token(this);
            }
        }
        if (other.data.templateSimplifierPointers != null) {
            for (TemplateSimplifierPointer pointer : other.data.templateSimplifierPointers) {
                pointer.token(other);
            }
        }
        swapAstReferences(this, other);

        if (link == other) {
            return;
        }
        if (other.link != null) {
            other.link.link = this;
        }
        if (link != null) {
            link.link = other;
        }
        Token tmpLink = link;
        link = other.link;
        other.link = tmpLink;
    }

    /**
     * After two tokens exchanged payloads every tree edge that named one of
     * them must name the other.
     */
    private static void swapAstReferences(Token a, Token b) {
        Set<Token> relatives = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Token t : new Token[]{a, b}) {
            relatives.add(t);
            if (t.data.astOperand1 != null) {
                relatives.add(t.data.astOperand1);
            }
            if (t.data.astOperand2 != null) {
                relatives.add(t.data.astOperand2);
            }
            if (t.data.astParent != null) {
                relatives.add(t.data.astParent);
            }
        }
        for (Token t : relatives) {
            t.data.astOperand1 = swapped(t.data.astOperand1, a, b);
            t.data.astOperand2 = swapped(t.data.astOperand2, a, b);
            t.data.astParent = swapped(t.data.astParent, a, b);
        }
    }

    private static Token swapped(Token t, Token a, Token b) {
        if (t == a) {
            return b;
        }
        return t == b ? a : t;
    }

    /**
     * Remove every token from {@code begin.next()} up to, not including, {@code end}.
     */
    public static void eraseTokens(Token begin, @Nullable Token end) {
        if (begin == null || begin == end) {
            return;
        }
        while (begin.next != null && begin.next != end) {
            begin.deleteNext();
        }
    }

    /**
     * Put the range {@code start..end} in place of {@code replaceThis}, which is removed.
     * The moved tokens take over the progress value of the replaced token.
     * Does nothing when any argument is null.
     */
    public static void replace(@Nullable Token replaceThis, @Nullable Token start, @Nullable Token end) {
        if (replaceThis == null || start == null || end == null) {
            return;
        }
        TokensFrontBack anchor = replaceThis.frontBack;
        unlinkRange(start, end, anchor);

        Token before = replaceThis.previous;
        Token after = replaceThis.next;
        if (before != null) {
            before.next = start;
        } else {
            anchor.front = start;
        }
        if (after != null) {
            after.previous = end;
        } else {
            anchor.back = end;
        }
        start.previous = before;
        end.next = after;

        for (Token tok = start; tok != null && tok != after; tok = tok.next) {
            tok.data.progressValue = replaceThis.data.progressValue;
        }
        replaceThis.previous = null;
        replaceThis.next = null;
        replaceThis.detach();
    }

    /**
     * Move the range {@code srcStart..srcEnd} to just after {@code newLocation}.
     * Does nothing when any argument is null.
     */
    public static void move(@Nullable Token srcStart, @Nullable Token srcEnd, @Nullable Token newLocation) {
        if (srcStart == null || srcEnd == null || newLocation == null) {
            return;
        }
        TokensFrontBack anchor = newLocation.frontBack;
        unlinkRange(srcStart, srcEnd, anchor);

        Token dest = newLocation.next;
        srcEnd.next = dest;
        srcStart.previous = newLocation;
        if (dest != null) {
            dest.previous = srcEnd;
        } else {
            anchor.back = srcEnd;
        }
        newLocation.next = srcStart;

        for (Token tok = srcStart; tok != null && tok != dest; tok = tok.next) {
            tok.data.progressValue = newLocation.data.progressValue;
        }
    }

    private static void unlinkRange(Token start, Token end, TokensFrontBack anchor) {
        Token before = start.previous;
        Token after = end.next;
        if (before != null) {
            before.next = after;
        } else if (anchor.front == start) {
            anchor.front = after;
        }
        if (after != null) {
            after.previous = before;
        } else if (anchor.back == end) {
            anchor.back = before;
        }
    }

    /**
     * Cut every reference between this token and the rest of the graph.
     */
    private void detach() {
        severRelations();
        next = null;
        previous = null;
    }

    private void severRelations() {
        if (link != null && link.link == this) {
            link.setLink(null);
        }
        link = null;
        Token parent = data.astParent;
        if (parent != null) {
            if (parent.data.astOperand1 == this) {
                parent.data.astOperand1 = null;
            }
            if (parent.data.astOperand2 == this) {
                parent.data.astOperand2 = null;
            }
            data.astParent = null;
        }
        if (data.astOperand1 != null && data.astOperand1.data.astParent == this) {
            data.astOperand1.data.astParent = null;
        }
        if (data.astOperand2 != null && data.astOperand2.data.astParent == this) {
            data.astOperand2.data.astParent = null;
        }
        data.astOperand1 = null;
        data.astOperand2 = null;
        if (data.templateSimplifierPointers != null) {
            for (TemplateSimplifierPointer pointer : data.templateSimplifierPointers) {
                pointer.token(null);
            }
            data.templateSimplifierPointers = null;
        }
    }

    /**
     * Number this token and every following one, continuing from the
     * index of the previous token.
     */
    public void assignIndexes() {
        int index = (previous != null ? previous.data.index : 0) + 1;
        for (Token tok = this; tok != null; tok = tok.next) {
            tok.data.index = index++;
        }
    }

    /**
     * Spread progress values 0..99 over the tokens from {@code tok} to the end.
     */
    public static void assignProgressValues(Token tok) {
        int total = 0;
        for (Token tok2 = tok; tok2 != null; tok2 = tok2.next) {
            ++total;
        }
        int count = 0;
        for (Token tok2 = tok; tok2 != null; tok2 = tok2.next) {
            tok2.data.progressValue = count++ * 100 / total;
        }
    }

    // ------------------------------------------------------------------
    // rendering

    public String stringify(StringifyOptions options) {
        return TokenPrinter.stringify(this, options);
    }

    public String stringifyList(StringifyOptions options, @Nullable List<String> fileNames, @Nullable Token end) {
        return TokenPrinter.stringifyList(this, options, fileNames, end);
    }

    @Override
    public String toString() {
        return str;
    }
}
