package com.raditha.astcore.analyzer;

import com.raditha.astcore.model.TokenList;

import java.util.List;

/**
 * A check run over the token sequence of one translation unit.
 * <p>
 * A pass may throw {@link com.raditha.astcore.error.InternalAnalysisException};
 * that aborts the unit it is working on and nothing else.
 */
@FunctionalInterface
public interface AnalysisPass {

    /**
     * @return human readable findings, empty when the unit is clean
     */
    List<String> run(TokenList tokens);
}
