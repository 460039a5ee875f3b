package com.oracle.lats.search.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StrategyScore {

    String strategyId;

    /**
     * Q-value of the leaf that produced the strategy.
     */
    double totalScore;

    /**
     * Share of all root visits that went through the leaf.
     */
    double confidence;

    String recommendation;
}
