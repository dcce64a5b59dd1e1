package com.raditha.astcore.config;

import com.raditha.astcore.model.Language;

/**
 * Settings consulted by the token core and the unit driver.
 *
 * @param language      language of the analysed sources, decides keyword classification
 * @param inconclusive  report facts whose certainty is inconclusive
 * @param warnings      report facts that only hold under a condition
 * @param sizeofWchar   size in bytes of {@code wchar_t}, used for wide string sizes
 * @param trackScopes   record lexical scopes while tokens are inserted
 * @param workerThreads number of translation units analysed in parallel
 */
public record AnalysisConfig(
        Language language,
        boolean inconclusive,
        boolean warnings,
        int sizeofWchar,
        boolean trackScopes,
        int workerThreads) {

    public AnalysisConfig {
        if (language == null) {
            throw new IllegalArgumentException("language cannot be null");
        }
        if (sizeofWchar != 2 && sizeofWchar != 4) {
            throw new IllegalArgumentException("sizeofWchar must be 2 or 4");
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1");
        }
    }

    /**
     * C++ sources, conditional facts reported, inconclusive ones hidden.
     */
    public static AnalysisConfig defaults() {
        return new AnalysisConfig(Language.CPP, false, true, 4, false, 4);
    }

    /**
     * Only facts that hold unconditionally and with certainty.
     */
    public static AnalysisConfig strict() {
        return new AnalysisConfig(Language.CPP, false, false, 4, false, 4);
    }

    /**
     * Everything, including inconclusive facts.
     */
    public static AnalysisConfig thorough() {
        return new AnalysisConfig(Language.CPP, true, true, 4, true, 4);
    }

    public AnalysisConfig withLanguage(Language newLanguage) {
        return new AnalysisConfig(newLanguage, inconclusive, warnings, sizeofWchar, trackScopes, workerThreads);
    }

    public AnalysisConfig withInconclusive(boolean enabled) {
        return new AnalysisConfig(language, enabled, warnings, sizeofWchar, trackScopes, workerThreads);
    }

    public AnalysisConfig withWarnings(boolean enabled) {
        return new AnalysisConfig(language, inconclusive, enabled, sizeofWchar, trackScopes, workerThreads);
    }
}
