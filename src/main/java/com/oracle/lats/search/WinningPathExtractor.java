package com.oracle.lats.search;

import com.oracle.lats.core.CodeStrategy;
import com.oracle.lats.core.ExecutionResult;
import com.oracle.lats.search.model.MctsConfig;
import com.oracle.lats.search.model.SearchMetrics;
import com.oracle.lats.search.model.SearchResult;
import com.oracle.lats.search.model.StrategyScore;
import com.oracle.lats.search.model.TerminationState;
import com.oracle.lats.search.model.ThoughtNode;
import com.oracle.lats.search.model.WinningPath;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the finished tree: per-strategy scores, the best leaf and its winning path.
 */
public class WinningPathExtractor {

    public static final String VERDICT_ACCEPT = "ACCEPT";
    public static final String VERDICT_REVISE = "REVISE";

    static final double SELECTED_THRESHOLD = 0.7;

    private final MctsConfig config;

    public WinningPathExtractor(MctsConfig config) {
        this.config = config;
    }

    /**
     * The most visited leaf that carries a completed strategy. Visit count reflects repeated
     * selection by the search and is less sensitive to one lucky rollout than the Q-value.
     */
    public Optional<ThoughtNode> findBestLeaf(ThoughtNode root) {
        ThoughtNode best = null;
        for (ThoughtNode leaf : TreeWalker.leaves(root)) {
            if (!leaf.hasCompletedStrategy()) {
                continue;
            }
            if (best == null || leaf.getVisitCount() > best.getVisitCount()) {
                best = leaf;
            }
        }
        return Optional.ofNullable(best);
    }

    public SearchResult buildResult(ThoughtNode root, SearchMetrics metrics, TerminationState state) {
        List<ThoughtNode> strategyLeaves = TreeWalker.leaves(root).stream()
                .filter(ThoughtNode::hasCompletedStrategy)
                .toList();

        List<CodeStrategy> strategies = new ArrayList<>();
        List<CodeStrategy> executed = new ArrayList<>();
        Map<String, StrategyScore> scores = new LinkedHashMap<>();
        int passed = 0;

        for (ThoughtNode leaf : strategyLeaves) {
            CodeStrategy strategy = leaf.getCompletedStrategy();
            strategies.add(strategy);
            if (leaf.getExecutionResult() != null) {
                executed.add(strategy);
            }
            double confidence = root.getVisitCount() > 0
                    ? (double) leaf.getVisitCount() / root.getVisitCount()
                    : 0.0;
            scores.put(strategy.getStrategyId(), StrategyScore.builder()
                    .strategyId(strategy.getStrategyId())
                    .totalScore(leaf.getQValue())
                    .confidence(confidence)
                    .recommendation(leaf.getQValue() >= SELECTED_THRESHOLD ? "LATS selected" : "Consider alternatives")
                    .build());
            if (leaf.getQValue() >= config.getPassThreshold()) {
                passed++;
            }
        }

        Optional<ThoughtNode> best = findBestLeaf(root);

        return SearchResult.builder()
                .allStrategies(strategies)
                .executedStrategies(executed)
                .scores(scores)
                .bestStrategyId(best.map(leaf -> leaf.getCompletedStrategy().getStrategyId()).orElse(null))
                .bestScore(best.map(ThoughtNode::getQValue).orElse(0.0))
                .totalGenerated(strategies.size())
                .totalExecuted(executed.size())
                .totalPassed(passed)
                .metrics(metrics)
                .terminationState(state)
                .root(root)
                .build();
    }

    public Optional<WinningPath> extract(ThoughtNode root, String problem, String problemType, SearchMetrics metrics) {
        return findBestLeaf(root).map(leaf -> {
            CodeStrategy strategy = leaf.getCompletedStrategy();
            return WinningPath.builder()
                    .problemDescription(problem)
                    .problemType(problemType == null ? "unknown" : problemType)
                    .thoughtSequence(leaf.getFullPath())
                    .finalStrategyId(strategy.getStrategyId())
                    .finalCodeChanges(strategy.getFileChanges())
                    .finalQValue(leaf.getQValue())
                    .totalIterations(metrics.getIterationsCompleted())
                    .totalNodesExplored(metrics.getNodesCreated())
                    .executionResult(describe(leaf.getExecutionResult()))
                    .reflectionVerdict(leaf.getQValue() >= config.getPassThreshold() ? VERDICT_ACCEPT : VERDICT_REVISE)
                    .llmModel(config.getLlmModel())
                    .latsConfig(config.snapshot())
                    .build();
        });
    }

    private static Map<String, Object> describe(ExecutionResult result) {
        Map<String, Object> description = new LinkedHashMap<>();
        if (result == null) {
            description.put("executed", false);
            return description;
        }
        description.put("executed", true);
        description.put("success", result.isSuccess());
        description.put("exit_code", result.getExitCode());
        description.put("tests_passed", result.getTestsPassed());
        description.put("tests_failed", result.getTestsFailed());
        description.put("test_pass_rate", result.testPassRate());
        description.put("execution_time_ms", result.getExecutionTimeMs());
        return description;
    }
}
