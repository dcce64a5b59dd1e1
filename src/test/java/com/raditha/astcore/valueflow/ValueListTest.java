package com.raditha.astcore.valueflow;

import com.raditha.astcore.config.AnalysisConfig;
import com.raditha.astcore.model.Language;
import com.raditha.astcore.model.Token;
import com.raditha.astcore.model.TokenList;
import com.raditha.astcore.symbols.ArgumentValidityOracle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ValueListTest {

    private ValueList list;

    @BeforeEach
    void setUp() {
        list = new ValueList();
    }

    private static Value possible(long v) {
        return Value.intValue(v);
    }

    @Test
    void testAdd_StoresACopy() {
        Value v = possible(3);
        assertTrue(list.add(v, 0));
        v.setIntValue(42);
        assertEquals(3, list.first().getIntValue());
        assertNotSame(v, list.first());
    }

    @Test
    void testAdd_InheritsTokenVarId() {
        list.add(possible(1), 7);
        list.add(possible(2).setVarId(3), 7);
        assertEquals(7, list.asList().get(0).getVarId());
        assertEquals(3, list.asList().get(1).getVarId());
    }

    @Test
    void testAdd_DuplicateRejected() {
        assertTrue(list.add(possible(1), 0));
        assertFalse(list.add(possible(1), 0));
        assertEquals(1, list.size());
    }

    @Test
    void testAdd_CertainFactReplacesInconclusiveOne() {
        list.add(possible(1).setInconclusive(), 0);
        assertTrue(list.add(possible(1), 0));
        assertEquals(1, list.size());
        assertTrue(list.first().isPossible());

        assertFalse(list.add(possible(1).setInconclusive(), 0));
        assertTrue(list.first().isPossible());
    }

    @Test
    void testAdd_KnownReplacesFactsOfSameType() {
        list.add(possible(5), 0);
        list.add(possible(7), 0);
        list.add(Value.containerSize(2), 0);

        assertTrue(list.add(possible(5).setKnown(), 0));
        assertEquals(2, list.size());
        assertTrue(list.hasKnownIntValue());
        assertEquals(5, list.first().getIntValue());
        assertTrue(list.asList().get(1).isContainerSizeValue());
    }

    @Test
    void testAdd_ConflictWithKnownRejected() {
        list.add(possible(5).setKnown(), 0);
        assertFalse(list.add(possible(7), 0));
        assertFalse(list.add(possible(6).setImpossible(), 0));
        assertFalse(list.add(possible(5), 0));
        assertEquals(1, list.size());
    }

    @Test
    void testAdd_KnownIntIsKeptFirst() {
        Token tok = new TokenList(Language.CPP).addTokens("\"s\"", 1);
        list.add(Value.tokValue(tok), 0);
        list.add(possible(3).setKnown(), 0);
        assertTrue(list.first().isKnown());
        assertTrue(list.first().isIntValue());
    }

    @Test
    void testAdd_CapRejectsEleventhFact() {
        for (int i = 0; i < ValueList.MAX_VALUES; i++) {
            assertTrue(list.add(possible(i * 10), 0));
        }
        assertFalse(list.add(possible(1000), 0));
        assertEquals(ValueList.MAX_VALUES, list.size());
    }

    @Test
    void testMerge_PointsBesideRangeFoldIntoRange() {
        list.add(possible(3), 0);
        list.add(possible(4), 0);
        list.add(possible(5).setBound(Bound.LOWER), 0);

        assertEquals(1, list.size());
        Value merged = list.first();
        assertEquals(Bound.LOWER, merged.getBound());
        assertEquals(3, merged.getIntValue());
        assertEquals(">=3", merged.toString());
    }

    @Test
    void testMerge_RangesWithSameBoundCollapse() {
        list.add(possible(3).setBound(Bound.LOWER), 0);
        list.add(possible(4).setBound(Bound.LOWER), 0);

        assertEquals(1, list.size());
        assertEquals(">=3", list.first().toString());
    }

    @Test
    void testMerge_UpperRange() {
        list.add(possible(10).setBound(Bound.UPPER), 0);
        list.add(possible(11), 0);
        list.add(possible(13), 0);

        assertEquals(2, list.size());
        assertEquals("[<=11, 13]", list.toString());
    }

    @Test
    void testContradiction_ImpossiblePointNarrowsRange() {
        list.add(possible(5).setBound(Bound.LOWER), 0);
        list.add(possible(5).setImpossible(), 0);

        assertEquals(2, list.size());
        assertEquals(">=6", list.asList().get(0).toString());
        assertEquals("!5", list.asList().get(1).toString());

        list.removeContradictions();
        assertEquals("[>=6, !5]", list.toString());
    }

    @Test
    void testContradiction_ImpossibleSamePointRemovesPossible() {
        list.add(possible(4), 0);
        list.add(possible(4).setImpossible(), 0);
        assertEquals(1, list.size());
        assertTrue(list.first().isImpossible());
    }

    @Test
    void testContradiction_ImpossibleUpperRangeCoversPoint() {
        list.add(possible(2), 0);
        list.add(possible(3).setImpossible().setBound(Bound.UPPER), 0);
        assertEquals(1, list.size());
        assertEquals("!<=3", list.first().toString());
    }

    @Test
    void testAdjacency() {
        assertTrue(ValueList.isAdjacent(possible(4), possible(5)));
        assertTrue(ValueList.isAdjacent(possible(4), possible(3)));
        assertFalse(ValueList.isAdjacent(possible(4), possible(6)));
        assertFalse(ValueList.isAdjacent(possible(Long.MIN_VALUE), possible(Long.MAX_VALUE)));
        assertTrue(ValueList.isAdjacent(possible(1).setBound(Bound.LOWER), possible(9).setBound(Bound.LOWER)));
        assertFalse(ValueList.isAdjacent(Value.floatValue(1.0), Value.floatValue(2.0)));
    }

    @Test
    void testQueries_ValueLookups() {
        list.add(possible(1), 0);
        list.add(possible(8), 0);
        list.add(possible(3).setImpossible(), 0);
        AnalysisConfig config = AnalysisConfig.defaults();

        assertEquals(8, list.getValue(8).getIntValue());
        assertNull(list.getValue(3));
        assertEquals(8, list.getValueNE(1).getIntValue());
        assertEquals(1, list.getValueLE(2, config).getIntValue());
        assertEquals(8, list.getValueGE(2, config).getIntValue());
        assertNull(list.getValueGE(9, config));
    }

    @Test
    void testQueries_MinAndMaxRespectConditionAndPath() {
        Token cond = new TokenList(Language.CPP).addTokens("if", 1);
        list.add(possible(1).setPath(1), 0);
        list.add(possible(9).setPath(2), 0);
        list.add(possible(20).setCondition(cond), 0);

        assertEquals(1, list.getMinValue(false, 0).getIntValue());
        assertEquals(9, list.getMaxValue(false, 0).getIntValue());
        assertEquals(1, list.getMaxValue(false, 1).getIntValue());
        assertEquals(20, list.getMaxValue(true, 0).getIntValue());
    }

    @Test
    void testQueries_OtherTypes() {
        list.add(Value.moved(MoveKind.NON_MOVED_VARIABLE), 0);
        assertNull(list.getMovedValue());
        list.add(Value.moved(MoveKind.MOVED_VARIABLE), 0);
        assertEquals(MoveKind.MOVED_VARIABLE, list.getMovedValue().getMoveKind());

        list.add(Value.containerSize(0), 0);
        assertNotNull(list.getContainerSizeValue(0));
        assertNull(list.getContainerSizeValue(1));
        assertFalse(list.hasKnownValue());
        assertNull(list.getKnownValue(ValueType.CONTAINER_SIZE));

        list.add(Value.containerSize(0).setKnown(), 0);
        assertTrue(list.hasKnownValue(ValueType.CONTAINER_SIZE));
        assertFalse(list.hasKnownIntValue());
        assertNull(list.getKnownValue(ValueType.INT));
    }

    @Test
    void testQueries_StringFacts() {
        TokenList tokens = new TokenList(Language.CPP);
        Token shortWide = tokens.addTokens("L\"ab\" \"abcd\" \"x\"", 1);
        list.add(Value.tokValue(shortWide), 0);
        list.add(Value.tokValue(shortWide.next()), 0);
        list.add(Value.tokValue(shortWide.tokAt(2)), 0);

        assertSame(shortWide.tokAt(2), list.getValueTokenMinStrSize(AnalysisConfig.defaults()).getTokValue());
        assertSame(shortWide.next(), list.getValueTokenMaxStrLength().getTokValue());
    }

    @Test
    void testKnownSymbolicValue() {
        Token tok = new TokenList(Language.CPP).addTokens("x y", 1);
        tok.setExprId(5);
        list.add(Value.symbolic(tok, 1).setKnown(), 0);
        assertTrue(list.hasKnownSymbolicValue(tok));
        assertFalse(list.hasKnownSymbolicValue(tok.next()));
    }

    @Test
    void testInvalidValue_PrefersUnconditionalCertainFact() {
        Token cond = new TokenList(Language.CPP).addTokens("if", 1);
        Token ftok = new TokenList(Language.CPP).addTokens("sqrt", 1);
        ArgumentValidityOracle oracle = mock(ArgumentValidityOracle.class);
        when(oracle.isIntArgValid(any(), eq(1), anyLong())).thenAnswer(inv -> inv.<Long>getArgument(2) >= 0);

        list.add(possible(-5).setCondition(cond), 0);
        list.add(possible(-1).setInconclusive(), 0);
        list.add(possible(2), 0);
        list.add(possible(-2), 0);

        Value invalid = list.getInvalidValue(ftok, 1, AnalysisConfig.thorough(), oracle);
        assertEquals(-2, invalid.getIntValue());
        verify(oracle, never()).isFloatArgValid(any(), anyInt(), anyDouble());
    }

    @Test
    void testInvalidValue_GatedBySettings() {
        Token cond = new TokenList(Language.CPP).addTokens("if", 1);
        Token ftok = new TokenList(Language.CPP).addTokens("sqrt", 1);
        ArgumentValidityOracle oracle = mock(ArgumentValidityOracle.class);
        when(oracle.isIntArgValid(any(), anyInt(), anyLong())).thenReturn(false);

        list.add(possible(-5).setCondition(cond), 0);
        assertNull(list.getInvalidValue(ftok, 1, AnalysisConfig.strict(), oracle));
        assertEquals(-5, list.getInvalidValue(ftok, 1, AnalysisConfig.defaults(), oracle).getIntValue());

        ValueList inconclusive = new ValueList();
        inconclusive.add(possible(-1).setInconclusive(), 0);
        assertNull(inconclusive.getInvalidValue(ftok, 1, AnalysisConfig.defaults(), oracle));
        assertEquals(-1, inconclusive.getInvalidValue(ftok, 1, AnalysisConfig.thorough(), oracle).getIntValue());
    }

    @Test
    void testInvalidValue_FloatFacts() {
        Token ftok = new TokenList(Language.CPP).addTokens("log", 1);
        ArgumentValidityOracle oracle = mock(ArgumentValidityOracle.class);
        when(oracle.isFloatArgValid(ftok, 1, 0.0)).thenReturn(false);
        when(oracle.isFloatArgValid(ftok, 1, 1.5)).thenReturn(true);

        list.add(Value.floatValue(1.5), 0);
        list.add(Value.floatValue(0.0), 0);
        assertEquals(0.0, list.getInvalidValue(ftok, 1, AnalysisConfig.defaults(), oracle).getFloatValue());
        assertNull(list.getInvalidValue(ftok, 1, AnalysisConfig.defaults(), ArgumentValidityOracle.permissive()));
    }
}
