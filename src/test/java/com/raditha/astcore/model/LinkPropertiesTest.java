package com.raditha.astcore.model;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LinkPropertiesTest {

    @Provide
    Arbitrary<String> balancedCode() {
        return Arbitraries.recursive(
                () -> Arbitraries.of("a", "1", "+", ";"),
                inner -> Arbitraries.oneOf(
                        inner.list().ofMinSize(1).ofMaxSize(4).map(parts -> String.join(" ", parts)),
                        inner.map(s -> "( " + s + " )"),
                        inner.map(s -> "[ " + s + " ]"),
                        inner.map(s -> "{ " + s + " }")),
                4);
    }

    @Provide
    Arbitrary<List<Integer>> deletions() {
        return Arbitraries.integers().between(0, 40).list().ofMaxSize(6);
    }

    @Property(tries = 200)
    void linksStayMutualAfterDeletions(@ForAll("balancedCode") String code,
                                       @ForAll("deletions") List<Integer> positions) {
        TokenList list = new TokenList(Language.CPP);
        list.addTokens("x " + code + " y", 1);
        list.createLinks();
        assertLinksMutual(list);

        int step = 0;
        for (int position : positions) {
            int size = list.size();
            Token tok = list.front().tokAt(position % size);
            switch (step++ % 3) {
                case 0 -> tok.deleteThis();
                case 1 -> tok.deleteNext();
                default -> tok.deletePrevious();
            }
            assertLinksMutual(list);
        }
    }

    @Property(tries = 100)
    void swapKeepsLinksMutual(@ForAll("balancedCode") String code, @ForAll("deletions") List<Integer> positions) {
        TokenList list = new TokenList(Language.CPP);
        list.addTokens("x " + code + " y", 1);
        list.createLinks();
        for (int position : positions) {
            Token tok = list.front().tokAt(position % list.size());
            tok.swapWithNext();
            assertLinksMutual(list);
        }
    }

    @Property(tries = 200)
    void moveKeepsBracketsPairedAndAnchorsRight(@ForAll("balancedCode") String moved,
                                                @ForAll("balancedCode") String rest,
                                                @ForAll("deletions") List<Integer> positions) {
        TokenList list = new TokenList(Language.CPP);
        list.addTokens(moved + " ; " + rest + " y", 1);
        list.createLinks();
        List<String> words = new ArrayList<>(Arrays.asList((moved + " ; " + rest + " y").split(" ")));
        int movedCount = moved.split(" ").length;
        int target = movedCount + (positions.isEmpty() ? 0 : positions.get(0)) % (words.size() - movedCount);

        Token.move(list.front(), list.front().tokAt(movedCount - 1), list.front().tokAt(target));

        List<String> expected = new ArrayList<>(words.subList(movedCount, words.size()));
        expected.addAll(target - movedCount + 1, words.subList(0, movedCount));
        assertEquals(String.join(" ", expected), text(list));
        assertLinksMutual(list);
        assertBracketsNest(list);
    }

    @Property(tries = 200)
    void replaceKeepsBracketsPairedAndAnchorsRight(@ForAll("balancedCode") String kept,
                                                   @ForAll("balancedCode") String replacement) {
        TokenList list = new TokenList(Language.CPP);
        list.addTokens("p " + kept + " ; " + replacement, 1);
        list.createLinks();
        Token p = list.front();
        int keptCount = kept.split(" ").length;

        Token.replace(p, p.tokAt(keptCount + 2), list.back());

        assertEquals(replacement + " " + kept + " ;", text(list));
        assertNull(p.next());
        assertNull(p.previous());
        assertLinksMutual(list);
        assertBracketsNest(list);
    }

    @Property(tries = 200)
    void eraseInsideBracketsKeepsOuterPair(@ForAll("balancedCode") String code) {
        TokenList list = new TokenList(Language.CPP);
        list.addTokens("x ( " + code + " ) y", 1);
        list.createLinks();
        Token open = list.front().next();
        Token close = open.link();

        Token.eraseTokens(open, close);

        assertEquals("x ( ) y", text(list));
        assertSame(close, open.link());
        assertSame(open, close.link());
        assertLinksMutual(list);
    }

    private static void assertLinksMutual(TokenList list) {
        Token previous = null;
        for (Token tok = list.front(); tok != null; tok = tok.next()) {
            assertSame(previous, tok.previous());
            if (tok.link() != null) {
                assertSame(tok, tok.link().link(), "link of " + tok.str() + " is not mutual");
            }
            previous = tok;
        }
        assertSame(previous, list.back());
    }

    private static void assertBracketsNest(TokenList list) {
        Deque<Token> open = new ArrayDeque<>();
        for (Token tok = list.front(); tok != null; tok = tok.next()) {
            String s = tok.str();
            if (s.equals("(") || s.equals("[") || s.equals("{")) {
                open.push(tok);
            } else if (s.equals(")") || s.equals("]") || s.equals("}")) {
                Token opening = open.pop();
                assertSame(opening, tok.link(), "bracket " + s + " paired with the wrong token");
            }
        }
        assertTrue(open.isEmpty());
    }

    private static String text(TokenList list) {
        StringBuilder sb = new StringBuilder();
        for (Token tok = list.front(); tok != null; tok = tok.next()) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(tok.str());
        }
        return sb.toString();
    }
}
