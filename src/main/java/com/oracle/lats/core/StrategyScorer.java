package com.oracle.lats.core;

public interface StrategyScorer {

    StrategyEvaluation score(CodeStrategy strategy, ExecutionResult executionResult);
}
