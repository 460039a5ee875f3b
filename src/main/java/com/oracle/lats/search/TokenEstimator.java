package com.oracle.lats.search;

import java.util.List;

/**
 * Token usage per phase. Implementations may report measured provider usage instead of estimates.
 */
public interface TokenEstimator {

    long expansion(String problem, List<String> generatedThoughts);

    long leafSimulation(boolean executionSucceeded);

    long intermediateSimulation(String thought);
}
