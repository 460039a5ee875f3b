package com.oracle.lats.search.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parameters of a single search run.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MctsConfig {

    @Builder.Default
    private int maxIterations = 100;

    @Builder.Default
    private int maxDepth = 5;

    @Builder.Default
    private double explorationConstant = 1.4;

    /**
     * Branching factor k: thoughts requested per expansion.
     */
    @Builder.Default
    private int strategiesPerExpansion = 3;

    @Builder.Default
    private double thoughtEvalThreshold = 0.5;

    @Builder.Default
    private double earlyStopThreshold = 0.9;

    @Builder.Default
    private boolean enableEarlyGiveup = true;

    @Builder.Default
    private int earlyGiveupIterations = 20;

    @Builder.Default
    private double earlyGiveupThreshold = 0.3;

    @Builder.Default
    private boolean enableBudgetLimit = true;

    @Builder.Default
    private long maxTotalTokens = 50_000;

    @Builder.Default
    private double maxCostUsd = 5.0;

    @Builder.Default
    private double costPer1kTokens = 0.01;

    private Long seed;

    /**
     * Model name recorded with the winning path. The executor chooses the model it calls.
     */
    private String llmModel;

    /**
     * Sampling settings of the executor, recorded with the winning path and never read by the search.
     */
    @Builder.Default
    private Map<String, Object> modelSettings = new LinkedHashMap<>();

    @Builder.Default
    private boolean enableReflexion = true;

    @Builder.Default
    private boolean saveWinningPaths = true;

    /**
     * Minimum score for a strategy to count as passed.
     */
    @Builder.Default
    private double passThreshold = 0.6;

    public void validate() {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, got " + maxDepth);
        }
        if (strategiesPerExpansion < 1) {
            throw new IllegalArgumentException("strategiesPerExpansion must be at least 1, got " + strategiesPerExpansion);
        }
        if (explorationConstant < 0) {
            throw new IllegalArgumentException("explorationConstant must not be negative");
        }
        if (costPer1kTokens < 0) {
            throw new IllegalArgumentException("costPer1kTokens must not be negative");
        }
        if (maxTotalTokens <= 0 || maxCostUsd <= 0) {
            throw new IllegalArgumentException("budget limits must be positive, got maxTotalTokens="
                    + maxTotalTokens + ", maxCostUsd=" + maxCostUsd);
        }
    }

    /**
     * The subset of settings recorded next to a winning path.
     */
    public Map<String, Object> snapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("max_iterations", maxIterations);
        snapshot.put("max_depth", maxDepth);
        snapshot.put("exploration_constant", explorationConstant);
        snapshot.put("strategies_per_expansion", strategiesPerExpansion);
        snapshot.put("early_stop_threshold", earlyStopThreshold);
        if (modelSettings != null) {
            snapshot.putAll(modelSettings);
        }
        if (seed != null) {
            snapshot.put("seed", seed);
        }
        return snapshot;
    }
}
