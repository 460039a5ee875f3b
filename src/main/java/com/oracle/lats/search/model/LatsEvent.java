package com.oracle.lats.search.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class LatsEvent {

    LatsEventType type;

    int iteration;

    String nodeId;

    String message;

    @Builder.Default
    Map<String, Object> metadata = Map.of();

    @Builder.Default
    Instant timestamp = Instant.now();
}
