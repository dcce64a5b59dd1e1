package com.raditha.astcore.ast;

import com.raditha.astcore.model.Language;
import com.raditha.astcore.model.Token;
import com.raditha.astcore.model.TokenList;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import static org.junit.jupiter.api.Assertions.*;

class BracketPropertiesTest {

    /**
     * Template types such as {@code map < int , vector < T > >}, with every
     * closer written as a separate token.
     */
    @Provide
    Arbitrary<String> templateTypes() {
        return Arbitraries.recursive(
                () -> Arbitraries.of("int", "T", "size_t", "Foo"),
                inner -> Arbitraries.oneOf(
                        inner,
                        inner.list().ofMinSize(1).ofMaxSize(3)
                                .map(args -> "box < " + String.join(" , ", args) + " >")),
                4);
    }

    @Property(tries = 200)
    void openingBracketInvertsClosingBracket(@ForAll("templateTypes") String type) {
        TokenList list = new TokenList(Language.CPP);
        list.addTokens(type + " value ;", 1);
        list.createLinks();
        list.createTemplateLinks();

        for (Token tok = list.front(); tok != null; tok = tok.next()) {
            if (tok.str().equals("<")) {
                Token closing = AstNavigator.findClosingBracket(tok);
                assertNotNull(closing, "no closer in " + type);
                assertEquals(">", closing.str());
                assertSame(tok, AstNavigator.findOpeningBracket(closing));
                assertSame(closing, tok.link());
                assertSame(tok, closing.link());
            }
        }
    }

    @Property(tries = 100)
    void typeEndIsTheDeclaredName(@ForAll("templateTypes") String type) {
        TokenList list = new TokenList(Language.CPP);
        list.addTokens(type + " , value ;", 1);
        list.createLinks();
        list.createTemplateLinks();

        Token end = AstNavigator.findTypeEnd(list.front());
        assertNotNull(end);
        assertEquals(",", end.str());
    }
}
