package com.oracle.lats.search;

import com.oracle.lats.core.LatsExecutionException;
import com.oracle.lats.core.SearchEventListener;
import com.oracle.lats.core.StrategyEvaluation;
import com.oracle.lats.core.StrategyScorer;
import com.oracle.lats.core.ThoughtEvaluation;
import com.oracle.lats.core.WinningPathStore;
import com.oracle.lats.evaluation.ThoughtEvaluator;
import com.oracle.lats.evaluation.ThoughtHeuristics;
import com.oracle.lats.search.model.LatsEvent;
import com.oracle.lats.search.model.LatsEventType;
import com.oracle.lats.search.model.MctsConfig;
import com.oracle.lats.search.model.SearchResult;
import com.oracle.lats.search.model.TerminationState;
import com.oracle.lats.search.model.ThoughtNode;
import com.oracle.lats.search.model.WinningPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class SearchEngineTest {

    private FakeLatsExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new FakeLatsExecutor();
    }

    private static StrategyScorer fixedScore(double score) {
        return (strategy, result) -> StrategyEvaluation.builder().totalScore(score).weaknesses("slow").build();
    }

    private SearchEngine engine(MctsConfig config, StrategyScorer scorer, SearchEventListener... listeners) {
        return SearchEngine.builder()
                .executor(executor)
                .scorer(scorer)
                .config(config)
                .listeners(List.of(listeners))
                .build();
    }

    @Test
    void singleIterationCreatesOneChildAndOneStrategy() {
        MctsConfig config = MctsConfig.builder().maxIterations(1).maxDepth(1).strategiesPerExpansion(1).build();

        SearchResult result = engine(config, fixedScore(0.8)).search("Fix the parser", Map.of());

        ThoughtNode root = result.getRoot();
        assertThat(root.getChildren()).hasSize(1);
        assertThat(root.getChildren().get(0).getId()).isEqualTo("root-0");
        assertThat(executor.strategyCalls).isEqualTo(1);
        assertThat(result.getTotalGenerated()).isEqualTo(1);
        assertThat(result.getTotalExecuted()).isEqualTo(1);
        assertThat(result.getBestStrategyId()).isEqualTo("s1");
        assertThat(result.getBestScore()).isEqualTo(0.8);
        assertThat(result.getTerminationState()).isEqualTo(TerminationState.MAX_ITERATIONS);
    }

    @Test
    void strategyGenerationFailureAbortsWithPartialTree() {
        executor.failStrategyOnCall = 2;
        MctsConfig config = MctsConfig.builder().maxIterations(3).maxDepth(1).strategiesPerExpansion(2).build();

        assertThatThrownBy(() -> engine(config, fixedScore(0.5)).search("Fix the parser", Map.of()))
                .isInstanceOfSatisfying(SearchAbortedException.class, aborted -> {
                    assertThat(aborted.getIteration()).isEqualTo(2);
                    assertThat(aborted.getCause()).isInstanceOf(LatsExecutionException.class)
                            .hasMessage("model unavailable");
                    ThoughtNode partial = aborted.getPartialTree();
                    assertThat(partial.getChildren()).hasSize(2);
                    assertThat(partial.getChildren().get(0).getVisitCount()).isEqualTo(1);
                    assertThat(aborted.getMetrics().getIterationsCompleted()).isEqualTo(1);
                });
    }

    @Test
    void stopsEarlyOnceALeafIsGoodEnough() {
        MctsConfig config = MctsConfig.builder()
                .maxIterations(10).maxDepth(1).strategiesPerExpansion(1).earlyStopThreshold(0.9).build();

        SearchResult result = engine(config, fixedScore(0.95)).search("Fix the parser", Map.of());

        assertThat(result.getTerminationState()).isEqualTo(TerminationState.EARLY_STOP);
        assertThat(result.getMetrics().getIterationsCompleted()).isEqualTo(1);
    }

    @Test
    void givesUpWhenEveryLeafStaysLow() {
        MctsConfig config = MctsConfig.builder()
                .maxIterations(10).maxDepth(1).strategiesPerExpansion(3)
                .enableEarlyGiveup(true).earlyGiveupIterations(2).earlyGiveupThreshold(0.3)
                .build();

        SearchResult result = engine(config, fixedScore(0.1)).search("Fix the parser", Map.of());

        assertThat(result.getTerminationState()).isEqualTo(TerminationState.EARLY_GIVEUP);
        assertThat(result.getMetrics().getIterationsCompleted()).isEqualTo(3);
    }

    @Test
    void budgetBreakerStopsBeforeTheNextIteration() {
        MctsConfig config = MctsConfig.builder()
                .maxIterations(10).maxDepth(1).strategiesPerExpansion(3)
                .costPer1kTokens(0.01).maxCostUsd(0.05).maxTotalTokens(1_000_000)
                .build();
        TokenEstimator fixed = new TokenEstimator() {
            @Override
            public long expansion(String problem, List<String> generatedThoughts) {
                return 0;
            }

            @Override
            public long leafSimulation(boolean executionSucceeded) {
                return 2500;
            }

            @Override
            public long intermediateSimulation(String thought) {
                return 0;
            }
        };

        SearchResult result = SearchEngine.builder()
                .executor(executor)
                .scorer(fixedScore(0.5))
                .config(config)
                .tokenEstimator(fixed)
                .build()
                .search("Fix the parser", Map.of());

        assertThat(result.getTerminationState()).isEqualTo(TerminationState.BUDGET_EXCEEDED);
        assertThat(result.getMetrics().getIterationsCompleted()).isEqualTo(2);
        assertThat(result.getMetrics().getTotalTokensUsed()).isEqualTo(5000);
        assertThat(executor.strategyCalls).isEqualTo(2);
    }

    @Test
    void sameInputsProduceTheSameTree() {
        MctsConfig config = MctsConfig.builder().maxIterations(12).maxDepth(3).strategiesPerExpansion(2).seed(42L).build();

        SearchResult first = engine(config, fixedScore(0.6)).search("Fix the parser", Map.of());
        executor = new FakeLatsExecutor();
        SearchResult second = engine(config, fixedScore(0.6)).search("Fix the parser", Map.of());

        List<String> firstShape = TreeWalker.breadthFirst(first.getRoot()).stream()
                .map(n -> n.getId() + ":" + n.getVisitCount() + ":" + n.getQValue())
                .toList();
        List<String> secondShape = TreeWalker.breadthFirst(second.getRoot()).stream()
                .map(n -> n.getId() + ":" + n.getVisitCount() + ":" + n.getQValue())
                .toList();
        assertThat(secondShape).isEqualTo(firstShape);
    }

    @Test
    void visitCountsStayConsistentAcrossTheTree() {
        MctsConfig config = MctsConfig.builder().maxIterations(15).maxDepth(3).strategiesPerExpansion(2).build();

        SearchResult result = engine(config, fixedScore(0.6)).search("Fix the parser", Map.of());

        ThoughtNode root = result.getRoot();
        assertThat(root.getVisitCount()).isEqualTo(result.getMetrics().getIterationsCompleted());
        for (ThoughtNode node : TreeWalker.breadthFirst(root)) {
            int childVisits = node.getChildren().stream().mapToInt(ThoughtNode::getVisitCount).sum();
            assertThat(node.getVisitCount()).isGreaterThanOrEqualTo(childVisits);
            assertThat(node.getDepth()).isLessThanOrEqualTo(config.getMaxDepth());
            assertThat(node.getQValue()).isBetween(0.0, 1.0);
        }
        assertThat(TreeWalker.countNodes(root) - 1).isEqualTo(result.getMetrics().getNodesCreated());
    }

    @Test
    void executionFailureBecomesZeroRewardAndReflexion() {
        executor.executionError = new IllegalStateException("IndexError: list index out of range");
        MctsConfig config = MctsConfig.builder().maxIterations(2).maxDepth(1).strategiesPerExpansion(2).build();

        SearchResult result = engine(config, fixedScore(0.9)).search("Fix the parser", Map.of());

        ThoughtNode root = result.getRoot();
        assertThat(root.getQValue()).isZero();
        assertThat(root.getRejectedReasons()).containsOnly("Index out of range - check list/array bounds");
        assertThat(result.getMetrics().getExecutionFailures()).isEqualTo(2);
        assertThat(executor.strategyContexts.get(1)).containsKey(ExpansionEngine.REJECTION_CONTEXT_KEY);
    }

    @Test
    void preCancelledSearchRunsNoIteration() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        MctsConfig config = MctsConfig.builder().maxIterations(5).maxDepth(2).build();

        SearchResult result = engine(config, fixedScore(0.5)).search("Fix the parser", Map.of(), token);

        assertThat(result.getTerminationState()).isEqualTo(TerminationState.CANCELLED);
        assertThat(result.getMetrics().getIterationsCompleted()).isZero();
        assertThat(result.getRoot().getChildren()).isEmpty();
        assertThat(executor.thoughtCalls).isZero();
    }

    @Test
    void cancellationDuringARunStopsAfterTheCurrentIteration() {
        CancellationToken token = new CancellationToken();
        SearchEventListener canceller = event -> {
            if (event.getType() == LatsEventType.ITERATION_START && event.getIteration() == 2) {
                token.cancel();
            }
        };
        MctsConfig config = MctsConfig.builder().maxIterations(10).maxDepth(2).strategiesPerExpansion(2).build();

        SearchResult result = engine(config, fixedScore(0.5), canceller).search("Fix the parser", Map.of(), token);

        assertThat(result.getTerminationState()).isEqualTo(TerminationState.CANCELLED);
        assertThat(result.getMetrics().getIterationsCompleted()).isEqualTo(2);
    }

    @Test
    void failingListenerDoesNotBreakTheSearch() {
        List<LatsEvent> seen = new ArrayList<>();
        SearchEventListener broken = event -> {
            throw new IllegalStateException("listener down");
        };
        MctsConfig config = MctsConfig.builder().maxIterations(2).maxDepth(1).strategiesPerExpansion(1).build();

        SearchResult result = engine(config, fixedScore(0.5), broken, seen::add).search("Fix the parser", Map.of());

        assertThat(result.getMetrics().getEventCallbackFailures()).isEqualTo(seen.size());
        assertThat(seen.get(0).getType()).isEqualTo(LatsEventType.SEARCH_START);
        assertThat(seen.get(seen.size() - 1).getType()).isEqualTo(LatsEventType.SEARCH_END);
        assertThat(seen).extracting(LatsEvent::getType)
                .contains(LatsEventType.SELECTION, LatsEventType.EXPANSION, LatsEventType.SIMULATION_END,
                        LatsEventType.BACKPROPAGATION, LatsEventType.BUDGET_CHECK);
    }

    @Test
    void recordsTheWinningPathWhenEnabled() {
        WinningPathStore store = mock(WinningPathStore.class);
        MctsConfig config = MctsConfig.builder().maxIterations(1).maxDepth(1).strategiesPerExpansion(1).build();

        SearchResult result = SearchEngine.builder()
                .executor(executor)
                .scorer(fixedScore(0.8))
                .config(config)
                .winningPathStore(store)
                .build()
                .search("Fix the parser", Map.of(SearchEngine.PROBLEM_TYPE_KEY, "bug_fix"));

        ArgumentCaptor<WinningPath> captor = ArgumentCaptor.forClass(WinningPath.class);
        verify(store).record(captor.capture());
        WinningPath path = captor.getValue();
        assertThat(path.getProblemType()).isEqualTo("bug_fix");
        assertThat(path.getThoughtSequence()).hasSize(2).first().isEqualTo("Problem: Fix the parser");
        assertThat(path.getReflectionVerdict()).isEqualTo(WinningPathExtractor.VERDICT_ACCEPT);
        assertThat(result.winningPath()).contains(path);
    }

    @Test
    void skipsAndSurvivesTheWinningPathStore() {
        WinningPathStore store = mock(WinningPathStore.class);
        doThrow(new IllegalStateException("disk full")).when(store).record(any());
        MctsConfig config = MctsConfig.builder().maxIterations(1).maxDepth(1).strategiesPerExpansion(1).build();

        SearchResult result = SearchEngine.builder()
                .executor(executor).scorer(fixedScore(0.8)).config(config).winningPathStore(store)
                .build()
                .search("Fix the parser", Map.of());
        assertThat(result.winningPath()).isPresent();

        WinningPathStore unused = mock(WinningPathStore.class);
        SearchEngine.builder()
                .executor(executor).scorer(fixedScore(0.8))
                .config(config.toBuilder().saveWinningPaths(false).build())
                .winningPathStore(unused)
                .build()
                .search("Fix the parser", Map.of());
        verify(unused, never()).record(any());
    }

    @Test
    void rejectsInvalidConfiguration() {
        MctsConfig config = MctsConfig.builder().maxDepth(0).build();

        assertThatThrownBy(() -> engine(config, fixedScore(0.5)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxDepth");
    }

    @Test
    void judgeOutageIsCountedOncePerThoughtEvaluation() {
        ThoughtEvaluator evaluator = new ThoughtEvaluator(new ThoughtHeuristics(), thought -> {
            throw new IllegalStateException("judge offline");
        });
        executor = new FakeLatsExecutor() {
            @Override
            public ThoughtEvaluation evaluateThought(String partialThought) {
                return evaluator.evaluate(partialThought);
            }
        };
        MctsConfig config = MctsConfig.builder().maxIterations(3).maxDepth(5).strategiesPerExpansion(1).build();

        SearchResult result = engine(config, fixedScore(0.8)).search("Fix the parser", Map.of());

        assertThat(executor.strategyCalls).isZero();
        assertThat(result.getMetrics().getEvaluationFallbacks()).isEqualTo(3);
        assertThat(result.getMetrics().toMap()).containsEntry("evaluation_fallbacks", 3);
    }
}
