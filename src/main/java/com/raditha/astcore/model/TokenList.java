package com.raditha.astcore.model;

import com.raditha.astcore.config.AnalysisConfig;
import com.raditha.astcore.error.InternalAnalysisException;
import com.raditha.astcore.error.InternalErrorType;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The token sequence of one translation unit.
 * <p>
 * Owns the front/back anchor shared by its tokens, the names of the files
 * the tokens came from and the language that decides which words are
 * keywords.
 */
public class TokenList {
    private static final Logger logger = LoggerFactory.getLogger(TokenList.class);

    private static final Set<String> C_KEYWORDS = Set.of(
            "auto", "break", "case", "char", "const", "continue", "default", "do", "double", "else",
            "enum", "extern", "float", "for", "goto", "if", "inline", "int", "long", "register",
            "restrict", "return", "short", "signed", "sizeof", "static", "struct", "switch", "typedef",
            "union", "unsigned", "void", "volatile", "while", "_Alignas", "_Alignof", "_Atomic", "_Bool",
            "_Complex", "_Generic", "_Imaginary", "_Noreturn", "_Static_assert", "_Thread_local");

    private static final Set<String> CPP_KEYWORDS;

    static {
        Set<String> cpp = new HashSet<>(C_KEYWORDS);
        cpp.removeIf(k -> k.startsWith("_") || k.equals("restrict"));
        Collections.addAll(cpp,
                "alignas", "alignof", "asm", "bool", "catch", "char8_t", "char16_t", "char32_t", "class",
                "concept", "consteval", "constexpr", "constinit", "const_cast", "co_await", "co_return",
                "co_yield", "decltype", "delete", "dynamic_cast", "explicit", "export", "false", "friend",
                "mutable", "namespace", "new", "noexcept", "nullptr", "operator", "private", "protected",
                "public", "reinterpret_cast", "requires", "static_assert", "static_cast", "template",
                "this", "thread_local", "throw", "true", "try", "typeid", "typename", "using", "virtual",
                "wchar_t");
        CPP_KEYWORDS = Set.copyOf(cpp);
    }

    private final TokensFrontBack frontBack = new TokensFrontBack();
    private final List<String> files = new ArrayList<>();
    private final Language language;
    private boolean trackScopes;

    public TokenList(Language language) {
        this.language = language;
    }

    public TokenList(AnalysisConfig config) {
        this(config.language());
        this.trackScopes = config.trackScopes();
    }

    public @Nullable Token front() {
        return frontBack.front;
    }

    public @Nullable Token back() {
        return frontBack.back;
    }

    public Language language() {
        return language;
    }

    public boolean isC() {
        return language == Language.C;
    }

    public boolean isCPP() {
        return language == Language.CPP;
    }

    public boolean isKeyword(String word) {
        return (isCPP() ? CPP_KEYWORDS : C_KEYWORDS).contains(word);
    }

    /**
     * Index of the file name, registering it when not known yet.
     */
    public int appendFileIfNew(String fileName) {
        int index = files.indexOf(fileName);
        if (index >= 0) {
            return index;
        }
        files.add(fileName);
        return files.size() - 1;
    }

    public List<String> getFiles() {
        return Collections.unmodifiableList(files);
    }

    /**
     * Give every token the root scope and keep scopes up to date on later insertions.
     */
    public void enableScopeTracking() {
        trackScopes = true;
        ScopeInfo root = null;
        for (Token tok = frontBack.front; tok != null; tok = tok.next()) {
            if (tok.scopeInfo() == null) {
                if (root == null) {
                    root = ScopeInfo.root();
                }
                tok.setScopeInfo(root);
            }
        }
    }

    public boolean isTrackingScopes() {
        return trackScopes;
    }

    /**
     * Append a token at the end of the sequence.
     *
     * @return the new token
     */
    public Token addToken(String str, int line, int column, int fileIndex) {
        Token tok;
        if (frontBack.back == null) {
            tok = new Token(this, frontBack);
            tok.setStr(str);
            frontBack.front = tok;
            frontBack.back = tok;
            if (trackScopes) {
                tok.setScopeInfo(ScopeInfo.root());
            }
        } else {
            tok = frontBack.back.insertToken(str);
        }
        tok.setLineNumber(line);
        tok.setColumn(column);
        tok.setFileIndex(fileIndex);
        tok.assignIndexes();
        return tok;
    }

    public Token addToken(String str) {
        Token back = frontBack.back;
        int line = back == null ? 1 : back.lineNumber();
        int column = back == null ? 1 : back.column() + back.str().length() + 1;
        int fileIndex = back == null ? 0 : back.fileIndex();
        return addToken(str, line, column, fileIndex);
    }

    /**
     * Append the space separated words of {@code code} on one line, with
     * consecutive columns.
     *
     * @return the first added token, or null when {@code code} is blank
     */
    public @Nullable Token addTokens(String code, int line) {
        Token first = null;
        int column = 1;
        for (String word : code.trim().split("\\s+")) {
            if (word.isEmpty()) {
                continue;
            }
            Token tok = addToken(word, line, column, 0);
            if (first == null) {
                first = tok;
            }
            column++;
        }
        return first;
    }

    /**
     * Pair {@code ( )}, {@code [ ]} and {@code { }}.
     *
     * @throws InternalAnalysisException when the brackets do not nest
     */
    public void createLinks() {
        Deque<Token> open = new ArrayDeque<>();
        for (Token tok = frontBack.front; tok != null; tok = tok.next()) {
            String s = tok.str();
            if (s.equals("(") || s.equals("[") || s.equals("{")) {
                open.push(tok);
            } else if (s.equals(")") || s.equals("]") || s.equals("}")) {
                Token opening = open.poll();
                if (opening == null || !closes(opening.str(), s)) {
                    throw new InternalAnalysisException(tok, "Unmatched '" + s + "'", InternalErrorType.SYNTAX);
                }
                Token.createMutualLinks(opening, tok);
            }
        }
        if (!open.isEmpty()) {
            Token unmatched = open.peek();
            throw new InternalAnalysisException(unmatched, "Unmatched '" + unmatched.str() + "'",
                    InternalErrorType.SYNTAX);
        }
        logger.debug("Linked brackets of {} tokens", size());
    }

    private static boolean closes(String opening, String closing) {
        return switch (opening) {
            case "(" -> closing.equals(")");
            case "[" -> closing.equals("]");
            default -> closing.equals("}");
        };
    }

    /**
     * Pair template angle brackets. Requires {@link #createLinks()} first.
     */
    public void createTemplateLinks() {
        int linked = 0;
        for (Token tok = frontBack.front; tok != null; tok = tok.next()) {
            if (tok.str().equals("<") && tok.link() == null) {
                Token closing = tok.findClosingBracket();
                if (closing != null && closing.str().equals(">")) {
                    Token.createMutualLinks(tok, closing);
                    linked++;
                }
            }
        }
        logger.debug("Linked {} template brackets", linked);
    }

    public void assignIndexes() {
        if (frontBack.front != null) {
            frontBack.front.assignIndexes();
        }
    }

    public void assignProgressValues() {
        if (frontBack.front != null) {
            Token.assignProgressValues(frontBack.front);
        }
    }

    public int size() {
        int count = 0;
        for (Token tok = frontBack.front; tok != null; tok = tok.next()) {
            count++;
        }
        return count;
    }
}
