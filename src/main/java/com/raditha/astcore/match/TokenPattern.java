package com.raditha.astcore.match;

import com.raditha.astcore.error.InternalAnalysisException;
import com.raditha.astcore.model.Token;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A pattern string compiled into one slot per space separated word.
 * <p>
 * Instances are immutable and shared between threads through the
 * {@link TokenMatcher} cache.
 */
final class TokenPattern {

    /** Result of matching a slot against one token. */
    static final int MATCH = 1;
    static final int EMPTY_ALTERNATIVE = 0;
    static final int NO_MATCH = -1;

    private final String source;
    private final List<Slot> slots;

    private TokenPattern(String source, List<Slot> slots) {
        this.source = source;
        this.slots = slots;
    }

    /**
     * Compile a pattern.
     *
     * @param context token reported when the pattern names an unknown wildcard
     */
    static TokenPattern compile(String pattern, Token context) {
        List<Slot> slots = new ArrayList<>();
        for (String word : pattern.split(" ")) {
            if (!word.isEmpty()) {
                slots.add(compileWord(word, context));
            }
        }
        return new TokenPattern(pattern, List.copyOf(slots));
    }

    private static Slot compileWord(String word, Token context) {
        if (word.charAt(0) == '[' && word.indexOf(']') > 0) {
            StringBuilder chars = new StringBuilder();
            int closing = 0;
            for (int i = 1; i < word.length(); i++) {
                if (word.charAt(i) == ']') {
                    closing++;
                } else {
                    chars.append(word.charAt(i));
                }
            }
            return new CharSet(chars.toString(), closing > 1);
        }
        if (word.startsWith("!!") && word.length() > 2) {
            return new Not(word.substring(2));
        }
        return Alternatives.compile(word, context);
    }

    List<Slot> slots() {
        return slots;
    }

    String source() {
        return source;
    }

    /**
     * Match the slots against consecutive tokens starting at {@code tok}.
     */
    boolean matches(Token tok, int varId) {
        for (Slot slot : slots) {
            if (tok == null) {
                if (slot instanceof Not) {
                    continue;
                }
                return false;
            }
            int result = slot.compare(tok, varId);
            if (result == NO_MATCH) {
                return false;
            }
            if (result == MATCH) {
                tok = tok.next();
            }
        }
        return true;
    }

    /**
     * One word of a pattern.
     */
    interface Slot {
        int compare(Token tok, int varId);
    }

    /** {@code !!word}: anything except the word; also satisfied past the end. */
    record Not(String word) implements Slot {
        @Override
        public int compare(Token tok, int varId) {
            return tok.str().equals(word) ? NO_MATCH : MATCH;
        }
    }

    /** {@code [chars]}: a single character token from the set. */
    record CharSet(String chars, boolean acceptsClosingBracket) implements Slot {
        @Override
        public int compare(Token tok, int varId) {
            String s = tok.str();
            if (s.length() != 1) {
                return NO_MATCH;
            }
            char c = s.charAt(0);
            if (chars.indexOf(c) >= 0 || (c == ']' && acceptsClosingBracket)) {
                return MATCH;
            }
            return NO_MATCH;
        }
    }

    /**
     * {@code a|%name%|}: literal words and wildcards, possibly with an empty
     * alternative. Options are tried in pattern order and the first match wins.
     */
    record Alternatives(List<Option> options, boolean allowsEmpty) implements Slot {

        static Alternatives compile(String word, Token context) {
            List<Option> options = new ArrayList<>();
            boolean empty = false;
            for (String alternative : word.split("\\|", -1)) {
                if (alternative.isEmpty()) {
                    empty = true;
                } else if (alternative.length() > 1 && alternative.charAt(0) == '%') {
                    Wildcard w = Wildcard.fromText(alternative);
                    if (w == null) {
                        throw new InternalAnalysisException(context, "Unexpected command");
                    }
                    options.add(new Option(null, w));
                } else {
                    options.add(new Option(alternative, null));
                }
            }
            return new Alternatives(List.copyOf(options), empty);
        }

        @Override
        public int compare(Token tok, int varId) {
            for (Option option : options) {
                if (option.matches(tok, varId)) {
                    return MATCH;
                }
            }
            if (allowsEmpty) {
                return tok.str().isEmpty() ? MATCH : EMPTY_ALTERNATIVE;
            }
            return NO_MATCH;
        }
    }

    /** One alternative: either a literal word or a wildcard. */
    record Option(@Nullable String literal, @Nullable Wildcard wildcard) {
        boolean matches(Token tok, int varId) {
            if (wildcard != null) {
                return wildcard.matches(tok, varId);
            }
            return tok.str().equals(literal);
        }
    }
}
