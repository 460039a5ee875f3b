package com.oracle.lats.search.model;

import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counters of one search run. Mutated only from the search loop.
 */
@Getter
public class SearchMetrics {

    public enum Phase {
        EXPANSION,
        SIMULATION
    }

    @Setter
    private int iterationsCompleted;

    private int nodesCreated;

    private long totalTokensUsed;

    private double totalCostUsd;

    private final Instant startTime;

    @Setter
    private Instant endTime;

    private final Map<Phase, Long> tokensByPhase = new EnumMap<>(Phase.class);

    private int executionFailures;

    private int evaluationFallbacks;

    private int eventCallbackFailures;

    public SearchMetrics() {
        this(Instant.now());
    }

    public SearchMetrics(Instant startTime) {
        this.startTime = startTime;
    }

    public void incrementNodesCreated() {
        nodesCreated++;
    }

    public void recordExecutionFailure() {
        executionFailures++;
    }

    public void recordEvaluationFallback() {
        evaluationFallbacks++;
    }

    public void recordEventCallbackFailure() {
        eventCallbackFailures++;
    }

    /**
     * Cost is derived from the token total rather than summed per call, so the
     * budget comparison does not drift with floating point accumulation.
     */
    public void addTokens(Phase phase, long tokens, double costPer1kTokens) {
        if (tokens <= 0) {
            return;
        }
        tokensByPhase.merge(phase, tokens, Long::sum);
        totalTokensUsed += tokens;
        totalCostUsd = totalTokensUsed / 1000.0 * costPer1kTokens;
    }

    public boolean exceedsBudget(MctsConfig config) {
        return totalTokensUsed >= config.getMaxTotalTokens()
                || totalCostUsd >= config.getMaxCostUsd();
    }

    public Map<Phase, Long> getTokensByPhase() {
        return Collections.unmodifiableMap(tokensByPhase);
    }

    public Duration getDuration() {
        Instant end = endTime != null ? endTime : Instant.now();
        return Duration.between(startTime, end);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("iterations_completed", iterationsCompleted);
        map.put("nodes_created", nodesCreated);
        map.put("total_tokens_used", totalTokensUsed);
        map.put("total_cost_usd", totalCostUsd);
        map.put("duration_ms", getDuration().toMillis());
        map.put("tokens_expansion", tokensByPhase.getOrDefault(Phase.EXPANSION, 0L));
        map.put("tokens_simulation", tokensByPhase.getOrDefault(Phase.SIMULATION, 0L));
        map.put("execution_failures", executionFailures);
        map.put("evaluation_fallbacks", evaluationFallbacks);
        map.put("event_callback_failures", eventCallbackFailures);
        return map;
    }
}
