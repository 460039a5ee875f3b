package com.oracle.lats.core;

import java.util.List;
import java.util.Map;

/**
 * Port through which the search talks to the language model and the sandbox.
 * One adapter per provider; the search never branches on which one it got.
 */
public interface LatsExecutor {

    /**
     * Proposes up to {@code k} next reasoning steps for the given state.
     *
     * @throws LatsExecutionException on timeout or provider failure; aborts the search
     */
    List<String> generateNextThoughts(String currentState, String problem, Map<String, Object> context, int k);

    /**
     * Turns a root-to-leaf thought path into a full strategy.
     *
     * @throws LatsExecutionException on provider failure; aborts the search
     */
    CodeStrategy generateCompleteStrategy(List<String> thoughtPath, String problem, Map<String, Object> context);

    /**
     * Runs the strategy in a sandbox. Any exception is treated as a failed rollout, not a failed search.
     */
    ExecutionResult executeStrategy(CodeStrategy strategy);

    /**
     * Scores an intermediate thought in [0, 1]; a degraded result means the judge was unavailable.
     */
    ThoughtEvaluation evaluateThought(String partialThought);
}
