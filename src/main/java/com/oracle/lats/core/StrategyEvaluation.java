package com.oracle.lats.core;

import lombok.Builder;
import lombok.Value;

/**
 * Rubric score of an executed strategy.
 */
@Value
@Builder
public class StrategyEvaluation {

    /**
     * In [0, 1].
     */
    double totalScore;

    /**
     * Free text describing what the strategy got wrong, may be empty.
     */
    String weaknesses;
}
