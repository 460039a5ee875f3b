package com.oracle.lats.core;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class AgentExperience {

    String problemDescription;

    ProblemType problemType;

    String strategyId;

    String strategyType;

    @Builder.Default
    List<String> filePaths = List.of();

    boolean success;

    double totScore;

    String reflectionVerdict;

    Double testPassRate;

    @Builder.Default
    List<String> tags = List.of();

    @Builder.Default
    Instant recordedAt = Instant.now();
}
