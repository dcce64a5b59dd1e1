package com.raditha.astcore.analyzer;

import java.util.List;

/**
 * Outcome of analysing one translation unit.
 * Internal errors are kept apart from findings: they describe a failure of
 * the analysis, not a problem in the analysed code.
 */
public record UnitReport(
        String unitName,
        int tokenCount,
        List<String> findings,
        List<String> internalErrors) {

    public boolean hasFindings() {
        return !findings.isEmpty();
    }

    public boolean isAborted() {
        return !internalErrors.isEmpty();
    }

    /**
     * Get summary statistics.
     */
    public String getSummary() {
        if (isAborted()) {
            return String.format("%s: aborted after internal error (%s)", unitName, internalErrors.get(0));
        }
        return String.format("%s: %d findings in %d tokens", unitName, findings.size(), tokenCount);
    }
}
