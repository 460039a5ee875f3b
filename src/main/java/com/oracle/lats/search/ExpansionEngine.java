package com.oracle.lats.search;

import com.oracle.lats.core.LatsExecutor;
import com.oracle.lats.search.model.MctsConfig;
import com.oracle.lats.search.model.SearchMetrics;
import com.oracle.lats.search.model.ThoughtNode;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Grows the tree under a selected node with thoughts proposed by the executor.
 */
@Slf4j
public class ExpansionEngine {

    public static final String REJECTION_CONTEXT_KEY = "rejection_context";

    private final LatsExecutor executor;
    private final MctsConfig config;
    private final ReflexionPropagator reflexion;
    private final TokenEstimator tokenEstimator;
    private final SearchMetrics metrics;

    public ExpansionEngine(LatsExecutor executor, MctsConfig config, ReflexionPropagator reflexion,
                           TokenEstimator tokenEstimator, SearchMetrics metrics) {
        this.executor = executor;
        this.config = config;
        this.reflexion = reflexion;
        this.tokenEstimator = tokenEstimator;
        this.metrics = metrics;
    }

    /**
     * Only non-terminal leaves above the depth limit are expanded; everything else is simulated as-is.
     */
    public boolean canExpand(ThoughtNode node) {
        return !node.isTerminal() && node.isLeaf() && node.getDepth() < config.getMaxDepth();
    }

    /**
     * Executor failures propagate unchanged and end the search.
     */
    public Expansion expand(ThoughtNode node, String problem, Map<String, Object> context) {
        List<String> nextThoughts = executor.generateNextThoughts(
                node.getSummary(),
                problem,
                withRejectionContext(context, node),
                config.getStrategiesPerExpansion());

        int created = 0;
        for (String thought : nextThoughts) {
            if (created >= config.getStrategiesPerExpansion()) {
                break;
            }
            if (thought == null || thought.isBlank()) {
                continue;
            }
            node.addChild(new ThoughtNode(thought, thought));
            metrics.incrementNodesCreated();
            created++;
        }
        log.debug("Expanded {} children from {}", created, node.getId());

        long tokens = tokenEstimator.expansion(problem, nextThoughts);
        ThoughtNode next = node.isLeaf() ? node : node.getChildren().get(0);
        return new Expansion(next, created, tokens);
    }

    /**
     * Adds the failure reasons collected on the node and on its parent (its siblings' failures).
     */
    Map<String, Object> withRejectionContext(Map<String, Object> context, ThoughtNode node) {
        String guidance = reflexion.getRejectionContext(node.getParent(), node).strip();
        if (guidance.isEmpty()) {
            return context;
        }
        Map<String, Object> enriched = new HashMap<>(context);
        enriched.put(REJECTION_CONTEXT_KEY, guidance);
        return enriched;
    }

    public static class Expansion {
        final ThoughtNode nodeToSimulate;
        final int childrenCreated;
        final long estimatedTokens;

        Expansion(ThoughtNode nodeToSimulate, int childrenCreated, long estimatedTokens) {
            this.nodeToSimulate = nodeToSimulate;
            this.childrenCreated = childrenCreated;
            this.estimatedTokens = estimatedTokens;
        }
    }
}
