package com.raditha.astcore.ast;

import com.raditha.astcore.error.InternalAnalysisException;
import com.raditha.astcore.error.InternalErrorType;
import com.raditha.astcore.model.Language;
import com.raditha.astcore.model.Token;
import com.raditha.astcore.model.TokenList;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AstNavigatorTest {

    private static Token linked(String code) {
        TokenList list = new TokenList(Language.CPP);
        Token first = list.addTokens(code, 1);
        list.createLinks();
        list.createTemplateLinks();
        return first;
    }

    private static void binary(Token op, Token lhs, Token rhs) {
        op.setAstOperand1(lhs);
        op.setAstOperand2(rhs);
    }

    @Test
    void testExpressionRange_IncludesGroupingParentheses() {
        Token tok = linked("( 1 + 2 ) ;");
        Token plus = tok.tokAt(2);
        binary(plus, tok.next(), tok.tokAt(3));

        TokenRange range = AstNavigator.findExpressionStartEndTokens(plus);
        assertSame(tok, range.start());
        assertSame(tok.tokAt(4), range.end());
        assertEquals("(1+2)", AstNavigator.expressionString(plus));
    }

    @Test
    void testExpressionRange_NestedBinaryOperators() {
        Token tok = linked("x = a + b * c ;");
        Token star = tok.tokAt(5);
        Token plus = tok.tokAt(3);
        Token assign = tok.next();
        binary(star, tok.tokAt(4), tok.tokAt(6));
        binary(plus, tok.tokAt(2), star);
        binary(assign, tok, plus);

        assertEquals("x=a+b*c", assign.expressionString());
        assertEquals("a+b*c", plus.expressionString());
        assertEquals("b*c", star.expressionString());
        TokenRange range = star.findExpressionStartEndTokens();
        assertSame(tok.tokAt(4), range.start());
        assertSame(tok.tokAt(6), range.end());
    }

    @Test
    void testExpressionRange_FunctionCallEndsAtClosingParenthesis() {
        Token tok = linked("f ( a , b ) ;");
        Token call = tok.next();
        Token comma = tok.tokAt(3);
        binary(comma, tok.tokAt(2), tok.tokAt(4));
        binary(call, tok, comma);

        TokenRange range = AstNavigator.findExpressionStartEndTokens(call);
        assertSame(tok, range.start());
        assertSame(tok.tokAt(5), range.end());
        assertEquals("f(a,b)", AstNavigator.expressionString(call));
    }

    @Test
    void testExpressionString_SpacesBetweenNames() {
        Token tok = linked("return x ;");
        assertEquals("return x", AstNavigator.stringFromTokenRange(tok, tok.next()));
        assertEquals("x", AstNavigator.expressionString(tok.next()));
    }

    @Test
    void testExpressionRange_OperandAfterTopIsRejected() {
        Token tok = linked("a b + ;");
        Token plus = tok.tokAt(2);
        binary(plus, tok, tok.next());

        InternalAnalysisException e = assertThrows(InternalAnalysisException.class,
                () -> AstNavigator.findExpressionStartEndTokens(plus));
        assertEquals("Cannot find end of expression", e.getMessage());
        assertEquals(InternalErrorType.AST, e.getType());
    }

    @Test
    void testFindClosingBracket_Template() {
        Token tok = linked("std :: vector < int > v ;");
        Token lt = tok.tokAt(3);
        assertSame(tok.tokAt(5), AstNavigator.findClosingBracket(lt));
        assertSame(lt, AstNavigator.findOpeningBracket(tok.tokAt(5)));
        assertSame(tok.tokAt(5), lt.link());
    }

    @Test
    void testFindClosingBracket_NestedAndShiftOperator() {
        Token tok = linked("std :: map < int , vector < int > > m ;");
        Token outer = tok.tokAt(3);
        Token inner = tok.tokAt(7);
        assertSame(tok.tokAt(10), AstNavigator.findClosingBracket(outer));
        assertSame(tok.tokAt(9), AstNavigator.findClosingBracket(inner));
        assertSame(outer, AstNavigator.findOpeningBracket(tok.tokAt(10)));
        assertSame(inner, AstNavigator.findOpeningBracket(tok.tokAt(9)));

        Token shifted = linked("map < int , vector < int >> m ;");
        assertEquals(">>", AstNavigator.findClosingBracket(shifted.next()).str());
        assertNull(shifted.next().link());
    }

    @Test
    void testFindClosingBracket_ComparisonIsNotATemplate() {
        Token tok = linked("if ( a < b ) { }");
        assertNull(AstNavigator.findClosingBracket(tok.tokAt(3)));
        assertNull(tok.tokAt(3).link());
        assertTrue(tok.tokAt(3).isComparisonOp());

        Token literal = linked("x = 1 < 2 ;");
        assertNull(AstNavigator.findClosingBracket(literal.tokAt(3)));
        assertNull(AstNavigator.findClosingBracket(literal));
    }

    @Test
    void testFindOpeningBracket_StopsAtStatementBoundary() {
        Token tok = linked("a ; b > c ;");
        assertNull(AstNavigator.findOpeningBracket(tok.tokAt(3)));
        assertNull(AstNavigator.findOpeningBracket(tok));
    }

    @Test
    void testIsCalculation() {
        Token tok = linked("a * b + c");
        Token star = tok.next();
        binary(star, tok, tok.tokAt(2));
        assertFalse(AstNavigator.isCalculation(star));
        tok.setVarId(1);
        assertTrue(AstNavigator.isCalculation(star));
        assertTrue(AstNavigator.isCalculation(tok.tokAt(3)));
        assertFalse(AstNavigator.isCalculation(tok.tokAt(4)));

        Token deref = linked("* p ;");
        deref.setAstOperand1(deref.next());
        assertFalse(AstNavigator.isCalculation(deref));
    }

    @Test
    void testIsUnaryPreOp() {
        Token pre = linked("x = ++ i ;");
        pre.tokAt(2).setAstOperand1(pre.tokAt(3));
        assertTrue(AstNavigator.isUnaryPreOp(pre.tokAt(2)));

        Token post = linked("y = i ++ ;");
        post.tokAt(3).setAstOperand1(post.tokAt(2));
        assertFalse(AstNavigator.isUnaryPreOp(post.tokAt(3)));

        Token minus = linked("- a");
        minus.setAstOperand1(minus.next());
        assertTrue(AstNavigator.isUnaryPreOp(minus));

        Token sum = linked("a + b");
        binary(sum.next(), sum, sum.tokAt(2));
        assertFalse(AstNavigator.isUnaryPreOp(sum.next()));
    }

    @Test
    void testNextArgument_SkipsNestedBrackets() {
        Token tok = linked("f ( a , ( b , c ) , d )");
        assertSame(tok.tokAt(4), AstNavigator.nextArgument(tok.tokAt(2)));
        assertSame(tok.tokAt(10), AstNavigator.nextArgument(tok.tokAt(4)));
        assertNull(AstNavigator.nextArgument(tok.tokAt(10)));
    }

    @Test
    void testNextTemplateArgument() {
        Token tok = linked("foo < int , bar < x , y > , z >");
        assertSame(tok.tokAt(4), AstNavigator.nextTemplateArgument(tok.tokAt(2)));
        assertSame(tok.tokAt(11), AstNavigator.nextTemplateArgument(tok.tokAt(4)));
        assertNull(AstNavigator.nextTemplateArgument(tok.tokAt(11)));
    }

    @Test
    void testNextArgumentBeforeTemplateLinks() {
        TokenList list = new TokenList(Language.CPP);
        Token tok = list.addTokens("f ( a < b , c > , d )", 1);
        list.createLinks();
        assertSame(tok.tokAt(9), AstNavigator.nextArgumentBeforeCreateLinks2(tok.tokAt(2)));
        assertSame(tok.tokAt(6), AstNavigator.nextArgument(tok.tokAt(2)));
    }

    @Test
    void testFindLambdaEndScope() {
        Token withParams = linked("[ ] ( int x ) { return x ; }");
        assertSame(withParams.tokAt(10), AstNavigator.findLambdaEndScope(withParams));

        Token bare = linked("[ ] { }");
        assertSame(bare.tokAt(3), AstNavigator.findLambdaEndScope(bare));

        Token mutable = linked("[ ] ( ) mutable { }");
        assertSame(mutable.tokAt(6), AstNavigator.findLambdaEndScope(mutable));

        Token subscript = linked("a [ 0 ] ;");
        assertNull(AstNavigator.findLambdaEndScope(subscript.next()));
    }

    @Test
    void testFindLambdaEndToken_FollowsTree() {
        Token tok = linked("[ ] ( ) { }");
        tok.tokAt(2).setAstOperand1(tok.tokAt(4));
        tok.setAstOperand1(tok.tokAt(2));
        assertSame(tok.tokAt(5), AstNavigator.findLambdaEndToken(tok));

        Token noTree = linked("[ ] ( ) { }");
        assertNull(AstNavigator.findLambdaEndToken(noTree));
    }

    @Test
    void testFindTypeEnd() {
        Token tok = linked("std :: vector < int > * , y");
        assertSame(tok.tokAt(7), AstNavigator.findTypeEnd(tok));
        assertSame(tok.tokAt(7), AstNavigator.findTypeEnd(tok.tokAt(7)));
    }

    @Test
    void testPrecedesAndSucceeds() {
        Token tok = linked("a b");
        Token b = tok.next();
        assertTrue(AstNavigator.precedes(tok, b));
        assertFalse(AstNavigator.precedes(b, tok));
        assertFalse(AstNavigator.precedes(tok, tok));
        assertTrue(AstNavigator.precedes(tok, null));
        assertFalse(AstNavigator.precedes(null, tok));
        assertTrue(AstNavigator.succeeds(b, tok));
        assertFalse(AstNavigator.succeeds(tok, b));
    }
}
