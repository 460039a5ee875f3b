package com.oracle.lats.search.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Root-to-leaf trace of the best strategy of a finished run, kept for reuse.
 */
@Value
@Builder
@Jacksonized
public class WinningPath {

    String problemDescription;

    String problemType;

    List<String> thoughtSequence;

    String finalStrategyId;

    Map<String, String> finalCodeChanges;

    double finalQValue;

    int totalIterations;

    int totalNodesExplored;

    Map<String, Object> executionResult;

    String reflectionVerdict;

    String llmModel;

    Map<String, Object> latsConfig;

    @Builder.Default
    Instant createdAt = Instant.now();
}
