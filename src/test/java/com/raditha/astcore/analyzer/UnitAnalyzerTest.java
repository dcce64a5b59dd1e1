package com.raditha.astcore.analyzer;

import com.raditha.astcore.config.AnalysisConfig;
import com.raditha.astcore.error.InternalAnalysisException;
import com.raditha.astcore.error.InternalErrorType;
import com.raditha.astcore.match.TokenMatcher;
import com.raditha.astcore.model.Language;
import com.raditha.astcore.model.Token;
import com.raditha.astcore.model.TokenList;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class UnitAnalyzerTest {

    /**
     * Reports every division by a literal zero.
     */
    private static final AnalysisPass DIVISION_BY_ZERO = tokens -> {
        List<String> findings = new ArrayList<>();
        for (Token tok = tokens.front(); tok != null; tok = tok.next()) {
            if (TokenMatcher.match(tok, "/ 0 !!.")) {
                findings.add("Division by zero at line " + tok.lineNumber());
            }
        }
        return findings;
    };

    private static TokenList unit(String fileName, String code) {
        TokenList list = new TokenList(Language.C);
        list.appendFileIfNew(fileName);
        list.addTokens(code, 1);
        return list;
    }

    @Test
    void testAnalyze_ReportsPerUnitInOrder() {
        Map<String, TokenList> units = new LinkedHashMap<>();
        for (int i = 0; i < 8; i++) {
            String code = i % 2 == 0 ? "y = x / 0 ;" : "y = x / 2 ;";
            units.put("unit" + i + ".c", unit("unit" + i + ".c", code));
        }

        List<UnitReport> reports = new UnitAnalyzer(AnalysisConfig.defaults(), DIVISION_BY_ZERO).analyze(units);

        assertEquals(8, reports.size());
        for (int i = 0; i < 8; i++) {
            UnitReport report = reports.get(i);
            assertEquals("unit" + i + ".c", report.unitName());
            assertEquals(i % 2 == 0, report.hasFindings());
            assertFalse(report.isAborted());
            assertEquals(6, report.tokenCount());
        }
        assertEquals(List.of("Division by zero at line 1"), reports.get(0).findings());
        assertEquals("unit1.c: 0 findings in 6 tokens", reports.get(1).getSummary());
    }

    @Test
    void testAnalyze_InternalErrorAbortsOnlyItsUnit() {
        TokenList good = unit("good.c", "a = 1 / 0 ;");
        TokenList bad = unit("bad.c", "a = ( ;");

        AnalysisPass pass = tokens -> {
            tokens.createLinks();
            return DIVISION_BY_ZERO.run(tokens);
        };
        Map<String, TokenList> units = new LinkedHashMap<>();
        units.put("bad.c", bad);
        units.put("good.c", good);

        List<UnitReport> reports = new UnitAnalyzer(AnalysisConfig.strict(), pass).analyze(units);

        UnitReport aborted = reports.get(0);
        assertTrue(aborted.isAborted());
        assertTrue(aborted.findings().isEmpty());
        assertEquals("[bad.c:1:3] SYNTAX: Unmatched '('", aborted.internalErrors().get(0));
        assertEquals("bad.c: aborted after internal error ([bad.c:1:3] SYNTAX: Unmatched '(')",
                aborted.getSummary());

        UnitReport clean = reports.get(1);
        assertFalse(clean.isAborted());
        assertEquals(1, clean.findings().size());
    }

    @Test
    void testAnalyzeUnit_MockedPassFailure() {
        TokenList tokens = unit("m.c", "f ( ) ;");
        AnalysisPass pass = mock(AnalysisPass.class);
        when(pass.run(tokens)).thenThrow(
                new InternalAnalysisException(tokens.front(), "Internal error. boom", InternalErrorType.INTERNAL));

        UnitReport report = new UnitAnalyzer(AnalysisConfig.defaults(), pass).analyzeUnit("m.c", tokens);

        assertEquals(List.of("[m.c:1:1] INTERNAL: Internal error. boom"), report.internalErrors());
        verify(pass, times(1)).run(tokens);
    }

    @Test
    void testAnalyze_OtherFailuresPropagate() {
        AnalysisPass pass = mock(AnalysisPass.class);
        when(pass.run(any())).thenThrow(new IllegalStateException("broken pass"));
        Map<String, TokenList> units = Map.of("x.c", unit("x.c", "x ;"));

        UnitAnalyzer analyzer = new UnitAnalyzer(AnalysisConfig.defaults(), pass);
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> analyzer.analyze(units));
        assertEquals("broken pass", e.getMessage());
    }

    @Test
    void testAnalyze_EachUnitRunsOnce() {
        AnalysisPass pass = mock(AnalysisPass.class);
        when(pass.run(any())).thenReturn(List.of());
        Map<String, TokenList> units = new LinkedHashMap<>();
        for (int i = 0; i < 5; i++) {
            units.put("u" + i, unit("u" + i, "int x ;"));
        }

        List<UnitReport> reports = new UnitAnalyzer(AnalysisConfig.defaults(), pass).analyze(units);

        assertEquals(5, reports.size());
        verify(pass, times(5)).run(any());
        for (TokenList tokens : units.values()) {
            verify(pass).run(tokens);
        }
    }
}
