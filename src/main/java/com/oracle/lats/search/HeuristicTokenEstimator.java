package com.oracle.lats.search;

import java.util.List;

/**
 * Word-count approximation of token usage. Not measured usage.
 */
public class HeuristicTokenEstimator implements TokenEstimator {

    static final long EXPANSION_OVERHEAD = 200;
    static final long LEAF_TOKENS = 500;
    static final long INTERMEDIATE_TOKENS = 50;

    @Override
    public long expansion(String problem, List<String> generatedThoughts) {
        return wordCount(problem) * 2L + EXPANSION_OVERHEAD;
    }

    @Override
    public long leafSimulation(boolean executionSucceeded) {
        // strategy generation dominates either way
        return LEAF_TOKENS;
    }

    @Override
    public long intermediateSimulation(String thought) {
        return INTERMEDIATE_TOKENS;
    }

    static int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }
}
