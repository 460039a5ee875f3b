package com.oracle.lats.core;

import lombok.Value;

/**
 * Score of an intermediate thought. {@code degraded} marks a neutral score used because the judge gave none.
 */
@Value
public class ThoughtEvaluation {

    double score;

    boolean degraded;

    public static ThoughtEvaluation of(double score) {
        return new ThoughtEvaluation(score, false);
    }

    public static ThoughtEvaluation degraded(double score) {
        return new ThoughtEvaluation(score, true);
    }
}
