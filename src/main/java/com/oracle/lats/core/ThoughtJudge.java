package com.oracle.lats.core;

/**
 * Model-based reviewer for intermediate thoughts.
 */
public interface ThoughtJudge {

    /**
     * @return a score in [0, 1], or {@code NaN} when the reply carried none; implementations may throw,
     *         callers degrade to a neutral score
     */
    double judge(String thought);
}
