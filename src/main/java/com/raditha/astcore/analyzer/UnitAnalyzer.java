package com.raditha.astcore.analyzer;

import com.raditha.astcore.config.AnalysisConfig;
import com.raditha.astcore.error.InternalAnalysisException;
import com.raditha.astcore.model.TokenList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs an {@link AnalysisPass} over independent translation units on a
 * fixed pool of worker threads.
 * <p>
 * Units share nothing but the compiled pattern cache, so each one is
 * analysed by a single thread without locking.
 */
public class UnitAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(UnitAnalyzer.class);

    private final AnalysisConfig config;
    private final AnalysisPass pass;

    public UnitAnalyzer(AnalysisConfig config, AnalysisPass pass) {
        this.config = config;
        this.pass = pass;
    }

    /**
     * Analyse every unit.
     *
     * @param units token sequences by unit name
     * @return one report per unit, in the iteration order of {@code units}
     */
    public List<UnitReport> analyze(Map<String, TokenList> units) {
        ExecutorService pool = Executors.newFixedThreadPool(config.workerThreads());
        try {
            List<CompletableFuture<UnitReport>> futures = new ArrayList<>();
            for (Map.Entry<String, TokenList> unit : units.entrySet()) {
                futures.add(CompletableFuture.supplyAsync(() -> analyzeUnit(unit.getKey(), unit.getValue()), pool));
            }
            List<UnitReport> reports = new ArrayList<>();
            for (CompletableFuture<UnitReport> future : futures) {
                reports.add(join(future));
            }
            long aborted = reports.stream().filter(UnitReport::isAborted).count();
            logger.info("Analyzed {} units, {} aborted", reports.size(), aborted);
            return reports;
        } finally {
            pool.shutdown();
        }
    }

    /**
     * Analyse one unit on the calling thread.
     */
    public UnitReport analyzeUnit(String name, TokenList tokens) {
        int tokenCount = tokens.size();
        try {
            List<String> findings = pass.run(tokens);
            logger.debug("{}: {} findings", name, findings.size());
            return new UnitReport(name, tokenCount, List.copyOf(findings), List.of());
        } catch (InternalAnalysisException e) {
            String diagnostic = e.toDiagnostic(tokens.getFiles());
            logger.warn("{}: analysis aborted: {}", name, diagnostic);
            return new UnitReport(name, tokenCount, List.of(), List.of(diagnostic));
        }
    }

    private static UnitReport join(CompletableFuture<UnitReport> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
