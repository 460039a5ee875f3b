package com.oracle.lats.search.policy;

import com.oracle.lats.search.BudgetTracker;
import com.oracle.lats.search.CancellationToken;
import com.oracle.lats.search.TreeWalker;
import com.oracle.lats.search.model.MctsConfig;
import com.oracle.lats.search.model.SearchMetrics;
import com.oracle.lats.search.model.TerminationState;
import com.oracle.lats.search.model.ThoughtNode;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Decides after each completed iteration whether the search goes on.
 * Priority: cancellation, budget, early give-up, early stop, iteration limit.
 */
@Slf4j
public class TerminationPolicy {

    private final MctsConfig config;
    private final BudgetTracker budget;

    public TerminationPolicy(MctsConfig config, BudgetTracker budget) {
        this.config = config;
        this.budget = budget;
    }

    public TerminationState evaluate(ThoughtNode root, SearchMetrics metrics, CancellationToken cancellation) {
        if (cancellation != null && cancellation.isCancelled()) {
            return TerminationState.CANCELLED;
        }
        if (budget.isTripped()) {
            return TerminationState.BUDGET_EXCEEDED;
        }

        List<ThoughtNode> leaves = TreeWalker.leaves(root);
        if (shouldGiveUp(leaves, metrics.getIterationsCompleted())) {
            return TerminationState.EARLY_GIVEUP;
        }
        if (hasGoodSolution(leaves)) {
            return TerminationState.EARLY_STOP;
        }
        if (metrics.getIterationsCompleted() >= config.getMaxIterations()) {
            return TerminationState.MAX_ITERATIONS;
        }
        return TerminationState.RUNNING;
    }

    boolean shouldGiveUp(List<ThoughtNode> leaves, int iterationsCompleted) {
        if (!config.isEnableEarlyGiveup() || iterationsCompleted <= config.getEarlyGiveupIterations()) {
            return false;
        }
        if (leaves.isEmpty()) {
            return false;
        }
        double bestQ = leaves.stream().mapToDouble(ThoughtNode::getQValue).max().orElse(0.0);
        if (bestQ < config.getEarlyGiveupThreshold()) {
            log.warn("Early give-up: best_q_value={} < {}", String.format("%.2f", bestQ),
                    config.getEarlyGiveupThreshold());
            return true;
        }
        return false;
    }

    boolean hasGoodSolution(List<ThoughtNode> leaves) {
        for (ThoughtNode leaf : leaves) {
            if (leaf.getQValue() >= config.getEarlyStopThreshold()) {
                return true;
            }
        }
        return false;
    }
}
