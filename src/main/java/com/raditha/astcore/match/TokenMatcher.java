package com.raditha.astcore.match;

import com.raditha.astcore.model.Token;
import org.jspecify.annotations.Nullable;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Matches token sequences against small textual patterns.
 * <p>
 * A pattern is a list of space separated words, each consumed by one token:
 * <ul>
 *     <li>{@code abc} the token text</li>
 *     <li>{@code a|b|c} any of the alternatives; a trailing {@code |} makes the word optional</li>
 *     <li>{@code [abc]} a single character token from the set</li>
 *     <li>{@code !!else} any token but {@code else}, or no token at all</li>
 *     <li>{@code %name%} and the other {@link Wildcard}s</li>
 * </ul>
 * Compiled patterns are cached and may be shared by concurrent analyses.
 */
public class TokenMatcher {

    private static final Map<String, TokenPattern> cache = new ConcurrentHashMap<>();

    private TokenMatcher() {
        /* this is only a utility class */
    }

    public static boolean match(@Nullable Token tok, String pattern) {
        return match(tok, pattern, 0);
    }

    /**
     * @param varId variable id required by {@code %varid%}
     */
    public static boolean match(@Nullable Token tok, String pattern, int varId) {
        if (pattern.isEmpty()) {
            return true;
        }
        return compiled(pattern, tok).matches(tok, varId);
    }

    /**
     * Match literal words only; no wildcards or alternatives are interpreted.
     */
    public static boolean simpleMatch(@Nullable Token tok, String pattern) {
        if (tok == null) {
            return false;
        }
        for (String word : pattern.split(" ")) {
            if (word.isEmpty()) {
                continue;
            }
            if (tok == null || !tok.str().equals(word)) {
                return false;
            }
            tok = tok.next();
        }
        return true;
    }

    /**
     * Compare one token against the first word of {@code haystack}.
     *
     * @return 1 on a match, 0 when only the empty alternative matched, -1 otherwise
     */
    public static int multiCompare(Token tok, String haystack, int varId) {
        int space = haystack.indexOf(' ');
        String word = space < 0 ? haystack : haystack.substring(0, space);
        return TokenPattern.Alternatives.compile(word, tok).compare(tok, varId);
    }

    public static @Nullable Token findMatch(@Nullable Token start, String pattern) {
        return findMatch(start, pattern, null, 0);
    }

    public static @Nullable Token findMatch(@Nullable Token start, String pattern, int varId) {
        return findMatch(start, pattern, null, varId);
    }

    /**
     * First token from {@code start}, stopping before {@code end}, where the pattern matches.
     */
    public static @Nullable Token findMatch(@Nullable Token start, String pattern, @Nullable Token end, int varId) {
        for (Token tok = start; tok != null && tok != end; tok = tok.next()) {
            if (match(tok, pattern, varId)) {
                return tok;
            }
        }
        return null;
    }

    public static @Nullable Token findSimpleMatch(@Nullable Token start, String pattern) {
        return findSimpleMatch(start, pattern, null);
    }

    public static @Nullable Token findSimpleMatch(@Nullable Token start, String pattern, @Nullable Token end) {
        for (Token tok = start; tok != null && tok != end; tok = tok.next()) {
            if (simpleMatch(tok, pattern)) {
                return tok;
            }
        }
        return null;
    }

    private static TokenPattern compiled(String pattern, Token context) {
        TokenPattern compiled = cache.get(pattern);
        if (compiled == null) {
            compiled = TokenPattern.compile(pattern, context);
            TokenPattern existing = cache.putIfAbsent(pattern, compiled);
            if (existing != null) {
                compiled = existing;
            }
        }
        return compiled;
    }

    static int cacheSize() {
        return cache.size();
    }
}
