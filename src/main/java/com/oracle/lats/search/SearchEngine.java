package com.oracle.lats.search;

import com.oracle.lats.core.LatsExecutor;
import com.oracle.lats.core.SearchEventListener;
import com.oracle.lats.core.StrategyScorer;
import com.oracle.lats.core.WinningPathStore;
import com.oracle.lats.persistence.TreeSnapshotWriter;
import com.oracle.lats.search.model.LatsEventType;
import com.oracle.lats.search.model.MctsConfig;
import com.oracle.lats.search.model.SearchMetrics;
import com.oracle.lats.search.model.SearchResult;
import com.oracle.lats.search.model.TerminationState;
import com.oracle.lats.search.model.ThoughtNode;
import com.oracle.lats.search.model.WinningPath;
import com.oracle.lats.search.policy.SelectionPolicy;
import com.oracle.lats.search.policy.TerminationPolicy;
import com.oracle.lats.search.policy.UctSelectionPolicy;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Monte Carlo Tree Search over LLM-generated thoughts.
 * <p>
 * Each iteration runs Selection (UCT), Expansion (thought generation), Simulation (strategy
 * execution at the last level, thought evaluation above it) and Backpropagation, then checks
 * the termination conditions. Iterations are strictly sequential: selection reads the whole tree.
 * <p>
 * The engine holds no per-run state, so one instance may serve several searches one after another.
 */
@Slf4j
public class SearchEngine {

    public static final String PROBLEM_TYPE_KEY = "problem_type";

    private final LatsExecutor executor;
    private final StrategyScorer scorer;
    private final MctsConfig config;
    private final List<SearchEventListener> listeners;
    private final WinningPathStore winningPathStore;
    private final TreeSnapshotWriter treeSnapshotWriter;
    private final TokenEstimator tokenEstimator;

    @Builder
    public SearchEngine(LatsExecutor executor,
                        StrategyScorer scorer,
                        MctsConfig config,
                        List<SearchEventListener> listeners,
                        WinningPathStore winningPathStore,
                        TreeSnapshotWriter treeSnapshotWriter,
                        TokenEstimator tokenEstimator) {
        if (executor == null || scorer == null) {
            throw new IllegalArgumentException("executor and scorer are required");
        }
        this.executor = executor;
        this.scorer = scorer;
        this.config = config != null ? config : new MctsConfig();
        this.config.validate();
        this.listeners = listeners != null ? List.copyOf(listeners) : List.of();
        this.winningPathStore = winningPathStore;
        this.treeSnapshotWriter = treeSnapshotWriter;
        this.tokenEstimator = tokenEstimator != null ? tokenEstimator : new HeuristicTokenEstimator();

        log.info("SearchEngine initialized: max_iter={}, max_depth={}, k={}, reflexion={}, winning_path_store={}",
                this.config.getMaxIterations(), this.config.getMaxDepth(), this.config.getStrategiesPerExpansion(),
                this.config.isEnableReflexion(), winningPathStore != null);
    }

    public SearchResult search(String problem, Map<String, Object> context) {
        return search(problem, context, CancellationToken.none());
    }

    /**
     * Runs the search to completion.
     *
     * @throws SearchAbortedException when thought or strategy generation fails
     */
    public SearchResult search(String problem, Map<String, Object> context, CancellationToken cancellation) {
        Map<String, Object> ctx = context != null ? context : Map.of();
        CancellationToken token = cancellation != null ? cancellation : CancellationToken.none();

        SearchMetrics metrics = new SearchMetrics();
        EventEmitter events = new EventEmitter(listeners, metrics);
        ReflexionPropagator reflexion = new ReflexionPropagator();
        BudgetTracker budget = new BudgetTracker(config, metrics);
        SelectionPolicy selection = new UctSelectionPolicy(config.getMaxDepth(), config.getExplorationConstant());
        ExpansionEngine expansion = new ExpansionEngine(executor, config, reflexion, tokenEstimator, metrics);
        SimulationEngine simulation = new SimulationEngine(executor, scorer, config, reflexion, tokenEstimator, metrics);
        BackpropagationEngine backpropagation = new BackpropagationEngine();
        TerminationPolicy termination = new TerminationPolicy(config, budget);

        log.info("Starting LATS search: {}", abbreviate(problem, 50));
        if (config.getSeed() != null) {
            log.info("LATS search with seed={} (deterministic mode)", config.getSeed());
        }
        events.emit(LatsEventType.SEARCH_START, 0, null, "Starting LATS search: " + abbreviate(problem, 50));

        ThoughtNode root = ThoughtNode.root(problem);
        TerminationState state = TerminationState.RUNNING;

        while (state == TerminationState.RUNNING) {
            int iteration = metrics.getIterationsCompleted() + 1;

            if (token.isCancelled()) {
                log.warn("LATS search cancelled before iteration {}", iteration);
                state = TerminationState.CANCELLED;
                events.emit(LatsEventType.CANCELLED, iteration - 1, null, "Search cancelled");
                break;
            }

            try {
                runIteration(iteration, root, problem, ctx, events, budget, selection, expansion,
                        simulation, backpropagation);
            } catch (RuntimeException e) {
                metrics.setEndTime(Instant.now());
                log.error("LATS search aborted at iteration {}: {}", iteration, e.getMessage());
                throw new SearchAbortedException("LATS search aborted at iteration " + iteration + ": "
                        + e.getMessage(), e, iteration, root, metrics);
            }

            metrics.setIterationsCompleted(iteration);
            state = termination.evaluate(root, metrics, token);
            emitTermination(state, iteration, metrics, events);
        }

        metrics.setEndTime(Instant.now());
        log.info("LATS completed: {} iterations, {} tokens, ${} cost, {}ms, state={}",
                metrics.getIterationsCompleted(), metrics.getTotalTokensUsed(),
                String.format("%.2f", metrics.getTotalCostUsd()), metrics.getDuration().toMillis(), state);

        WinningPathExtractor extractor = new WinningPathExtractor(config);
        SearchResult result = extractor.buildResult(root, metrics, state);

        Object problemType = ctx.get(PROBLEM_TYPE_KEY);
        Optional<WinningPath> winningPath = extractor.extract(root, problem,
                problemType != null ? problemType.toString() : null, metrics);
        if (config.isSaveWinningPaths() && winningPathStore != null) {
            winningPath.ifPresent(this::recordWinningPath);
        }

        if (treeSnapshotWriter != null && log.isDebugEnabled()) {
            treeSnapshotWriter.write(root, metrics, UUID.randomUUID().toString());
        }

        events.emit(LatsEventType.SEARCH_END, metrics.getIterationsCompleted(), null, "LATS search completed",
                Map.of("total_tokens", metrics.getTotalTokensUsed(),
                        "total_cost", metrics.getTotalCostUsd(),
                        "best_q_value", bestChildQ(root),
                        "termination_state", state.name()));

        return result.toBuilder()
                .winningPath(winningPath.orElse(null))
                .build();
    }

    private void runIteration(int iteration, ThoughtNode root, String problem, Map<String, Object> ctx,
                              EventEmitter events, BudgetTracker budget, SelectionPolicy selection,
                              ExpansionEngine expansion, SimulationEngine simulation,
                              BackpropagationEngine backpropagation) {
        log.debug("MCTS Iteration {}/{}", iteration, config.getMaxIterations());
        events.emit(LatsEventType.ITERATION_START, iteration, null,
                "Iteration " + iteration + "/" + config.getMaxIterations());

        // 1. Selection
        ThoughtNode node = selection.select(root);
        events.emit(LatsEventType.SELECTION, iteration, node.getId(), "Selected node: " + node.getId(),
                Map.of("q_value", node.getQValue(), "visit_count", node.getVisitCount()));

        // 2. Expansion
        if (expansion.canExpand(node)) {
            events.emit(LatsEventType.EXPANSION, iteration, node.getId(), "Expanding node (generating thoughts)...");
            ExpansionEngine.Expansion expanded = expansion.expand(node, problem, ctx);
            budget.record(SearchMetrics.Phase.EXPANSION, expanded.estimatedTokens);
            node = expanded.nodeToSimulate;
        }

        // 3. Simulation
        events.emit(LatsEventType.SIMULATION_START, iteration, node.getId(), "Simulating node...");
        SimulationEngine.Rollout rollout = simulation.simulate(node, problem, ctx);
        budget.record(SearchMetrics.Phase.SIMULATION, rollout.estimatedTokens);
        events.emit(LatsEventType.SIMULATION_END, iteration, node.getId(),
                String.format("Simulation complete: value=%.2f", rollout.reward),
                Map.of("value", rollout.reward));

        // 4. Backpropagation
        events.emit(LatsEventType.BACKPROPAGATION, iteration, node.getId(), "Updating Q-values...");
        backpropagation.backpropagate(node, rollout.reward);
    }

    private void emitTermination(TerminationState state, int iteration, SearchMetrics metrics, EventEmitter events) {
        switch (state) {
            case BUDGET_EXCEEDED -> events.emit(LatsEventType.BUDGET_CHECK, iteration, null,
                    String.format("Budget exceeded ($%.2f)", metrics.getTotalCostUsd()),
                    Map.of("tokens", metrics.getTotalTokensUsed(), "cost", metrics.getTotalCostUsd(),
                            "exceeded", true));
            case EARLY_GIVEUP -> {
                log.warn("Early give-up at iteration {}", iteration);
                events.emit(LatsEventType.EARLY_GIVEUP, iteration, null, "Low confidence, giving up");
            }
            case EARLY_STOP -> {
                log.info("Early stop at iteration {}", iteration);
                events.emit(LatsEventType.EARLY_STOP, iteration, null, "Early stop (good solution found)");
            }
            case CANCELLED -> {
                log.warn("LATS search cancelled at iteration {}", iteration);
                events.emit(LatsEventType.CANCELLED, iteration, null, "Search cancelled");
            }
            default -> events.emit(LatsEventType.BUDGET_CHECK, iteration, null, "Budget ok",
                    Map.of("tokens", metrics.getTotalTokensUsed(), "cost", metrics.getTotalCostUsd(),
                            "exceeded", false));
        }
    }

    private void recordWinningPath(WinningPath winningPath) {
        try {
            winningPathStore.record(winningPath);
        } catch (Exception e) {
            log.warn("Failed to record winning path: {}", e.getMessage());
        }
    }

    private static double bestChildQ(ThoughtNode root) {
        return root.getChildren().stream().mapToDouble(ThoughtNode::getQValue).max().orElse(0.0);
    }

    private static String abbreviate(String s, int maxLen) {
        if (s == null) return "null";
        return s.length() <= maxLen ? s : (s.substring(0, maxLen) + "...");
    }
}
