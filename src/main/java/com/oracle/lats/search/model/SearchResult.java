package com.oracle.lats.search.model;

import com.oracle.lats.core.CodeStrategy;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Value
@Builder(toBuilder = true)
public class SearchResult {

    @Builder.Default
    List<CodeStrategy> allStrategies = List.of();

    @Builder.Default
    List<CodeStrategy> executedStrategies = List.of();

    @Builder.Default
    Map<String, StrategyScore> scores = Map.of();

    String bestStrategyId;

    double bestScore;

    int totalGenerated;

    int totalExecuted;

    int totalPassed;

    SearchMetrics metrics;

    TerminationState terminationState;

    WinningPath winningPath;

    ThoughtNode root;

    public Optional<WinningPath> winningPath() {
        return Optional.ofNullable(winningPath);
    }
}
