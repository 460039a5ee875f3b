package com.oracle.lats.search;

import com.oracle.lats.search.model.MctsConfig;
import com.oracle.lats.search.model.SearchMetrics;
import lombok.extern.slf4j.Slf4j;

/**
 * Token and cost accounting plus the circuit breaker over it.
 */
@Slf4j
public class BudgetTracker {

    private final MctsConfig config;
    private final SearchMetrics metrics;

    public BudgetTracker(MctsConfig config, SearchMetrics metrics) {
        this.config = config;
        this.metrics = metrics;
    }

    public void record(SearchMetrics.Phase phase, long tokens) {
        metrics.addTokens(phase, tokens, config.getCostPer1kTokens());
    }

    /**
     * Only consulted between iterations; a running iteration always completes.
     */
    public boolean isTripped() {
        if (!config.isEnableBudgetLimit()) {
            return false;
        }
        boolean exceeded = metrics.exceedsBudget(config);
        if (exceeded) {
            log.warn("Budget exceeded! Tokens: {}/{}, Cost: ${}/${}",
                    metrics.getTotalTokensUsed(), config.getMaxTotalTokens(),
                    String.format("%.2f", metrics.getTotalCostUsd()),
                    String.format("%.2f", config.getMaxCostUsd()));
        }
        return exceeded;
    }
}
