package com.oracle.lats.search.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SearchMetricsTest {

    @Test
    void tokensAreTrackedPerPhaseAndCostFollowsTheTotal() {
        SearchMetrics metrics = new SearchMetrics();

        metrics.addTokens(SearchMetrics.Phase.EXPANSION, 1200, 0.01);
        metrics.addTokens(SearchMetrics.Phase.SIMULATION, 800, 0.01);
        metrics.addTokens(SearchMetrics.Phase.SIMULATION, 0, 0.01);

        assertThat(metrics.getTotalTokensUsed()).isEqualTo(2000);
        assertThat(metrics.getTotalCostUsd()).isEqualTo(0.02);
        assertThat(metrics.getTokensByPhase())
                .containsEntry(SearchMetrics.Phase.EXPANSION, 1200L)
                .containsEntry(SearchMetrics.Phase.SIMULATION, 800L);
    }

    @Test
    void freshMetricsAreWithinBudget() {
        MctsConfig config = MctsConfig.builder().maxTotalTokens(100).maxCostUsd(0.01).build();
        SearchMetrics metrics = new SearchMetrics();

        assertThat(metrics.exceedsBudget(config)).isFalse();
        metrics.addTokens(SearchMetrics.Phase.EXPANSION, 100, 0.0);
        assertThat(metrics.exceedsBudget(config)).isTrue();
    }

    @Test
    void mapViewUsesSnakeCaseKeys() {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        SearchMetrics metrics = new SearchMetrics(start);
        metrics.setEndTime(start.plus(Duration.ofMillis(1500)));
        metrics.setIterationsCompleted(4);
        metrics.recordExecutionFailure();

        assertThat(metrics.toMap())
                .containsEntry("iterations_completed", 4)
                .containsEntry("duration_ms", 1500L)
                .containsEntry("execution_failures", 1)
                .containsKeys("total_tokens_used", "total_cost_usd", "event_callback_failures");
    }
}
