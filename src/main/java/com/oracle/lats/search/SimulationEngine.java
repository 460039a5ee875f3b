package com.oracle.lats.search;

import com.oracle.lats.core.CodeStrategy;
import com.oracle.lats.core.ExecutionResult;
import com.oracle.lats.core.LatsExecutor;
import com.oracle.lats.core.StrategyEvaluation;
import com.oracle.lats.core.StrategyScorer;
import com.oracle.lats.core.ThoughtEvaluation;
import com.oracle.lats.search.model.MctsConfig;
import com.oracle.lats.search.model.SearchMetrics;
import com.oracle.lats.search.model.ThoughtNode;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;

/**
 * Produces the reward of one rollout. Nodes at the last level get a full strategy that is
 * executed and scored; shallower nodes only get their thought evaluated.
 */
@Slf4j
public class SimulationEngine {

    static final double LOW_SCORE_THRESHOLD = 0.5;
    static final double NEUTRAL_SCORE = 0.5;
    private static final int MAX_WEAKNESS_CHARS = 100;

    private final LatsExecutor executor;
    private final StrategyScorer scorer;
    private final MctsConfig config;
    private final ReflexionPropagator reflexion;
    private final TokenEstimator tokenEstimator;
    private final SearchMetrics metrics;

    public SimulationEngine(LatsExecutor executor, StrategyScorer scorer, MctsConfig config,
                            ReflexionPropagator reflexion, TokenEstimator tokenEstimator, SearchMetrics metrics) {
        this.executor = executor;
        this.scorer = scorer;
        this.config = config;
        this.reflexion = reflexion;
        this.tokenEstimator = tokenEstimator;
        this.metrics = metrics;
    }

    public Rollout simulate(ThoughtNode node, String problem, Map<String, Object> context) {
        if (node.getDepth() >= config.getMaxDepth() - 1) {
            return simulateLeaf(node, problem, context);
        }
        return simulateIntermediate(node);
    }

    Rollout simulateLeaf(ThoughtNode node, String problem, Map<String, Object> context) {
        // generation failures are fatal and are not caught here
        CodeStrategy strategy = executor.generateCompleteStrategy(
                node.getFullPath(), problem, withSiblingFailures(context, node));

        node.markTerminal(strategy);

        ExecutionResult executionResult;
        try {
            executionResult = executor.executeStrategy(strategy);
        } catch (Exception e) {
            metrics.recordExecutionFailure();
            if (config.isEnableReflexion()) {
                String reason = reflexion.extractFailureReason(node, e.getMessage());
                reflexion.propagateToParent(node, reason);
            }
            log.warn("Execution failed for {}: {}", node.getId(), e.getMessage());
            return new Rollout(0.0, tokenEstimator.leafSimulation(false));
        }
        node.setExecutionResult(executionResult);

        StrategyEvaluation evaluation = scorer.score(strategy, executionResult);
        double score = clamp(evaluation.getTotalScore());

        if (config.isEnableReflexion() && score < LOW_SCORE_THRESHOLD) {
            String weakness = evaluation.getWeaknesses();
            if (weakness == null || weakness.isBlank()) {
                weakness = "unknown";
            } else if (weakness.length() > MAX_WEAKNESS_CHARS) {
                weakness = weakness.substring(0, MAX_WEAKNESS_CHARS);
            }
            reflexion.propagateToParent(node, String.format("Low score (%.2f): %s", score, weakness));
        }

        log.debug("Leaf simulation: {} -> {}", node.getId(), String.format("%.2f", score));
        return new Rollout(score, tokenEstimator.leafSimulation(true));
    }

    Rollout simulateIntermediate(ThoughtNode node) {
        double thoughtScore;
        try {
            ThoughtEvaluation evaluation = executor.evaluateThought(node.getPartialThought());
            if (evaluation.isDegraded()) {
                metrics.recordEvaluationFallback();
            }
            thoughtScore = clamp(evaluation.getScore());
        } catch (Exception e) {
            metrics.recordEvaluationFallback();
            log.warn("Thought evaluation failed for {}, using neutral score: {}", node.getId(), e.getMessage());
            thoughtScore = NEUTRAL_SCORE;
        }

        node.setThoughtScore(thoughtScore);
        node.setPromising(thoughtScore >= config.getThoughtEvalThreshold());

        if (config.isEnableReflexion() && !node.isPromising()) {
            String reason = reflexion.extractFailureReason(node, null);
            if (!ReflexionPropagator.UNKNOWN_FAILURE.equals(reason)) {
                reflexion.propagateToParent(node, reason);
            }
        }

        log.debug("Thought eval: {} -> {} ({})", node.getId(), String.format("%.2f", thoughtScore),
                node.isPromising() ? "promising" : "unpromising");
        return new Rollout(thoughtScore, tokenEstimator.intermediateSimulation(node.getPartialThought()));
    }

    private Map<String, Object> withSiblingFailures(Map<String, Object> context, ThoughtNode node) {
        String guidance = reflexion.getRejectionContext(node.getParent());
        if (guidance.isEmpty()) {
            return context;
        }
        Map<String, Object> enriched = new HashMap<>(context);
        enriched.put(ExpansionEngine.REJECTION_CONTEXT_KEY, guidance.strip());
        return enriched;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    public static class Rollout {
        final double reward;
        final long estimatedTokens;

        Rollout(double reward, long estimatedTokens) {
            this.reward = reward;
            this.estimatedTokens = estimatedTokens;
        }

        public double getReward() {
            return reward;
        }

        public long getEstimatedTokens() {
            return estimatedTokens;
        }
    }
}
