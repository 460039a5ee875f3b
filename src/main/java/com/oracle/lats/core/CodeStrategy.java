package com.oracle.lats.core;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * A complete, executable candidate solution produced for a terminal node.
 */
@Value
@Builder
@Jacksonized
public class CodeStrategy {

    String strategyId;

    String title;

    String description;

    /**
     * File path to full file content.
     */
    @Builder.Default
    Map<String, String> fileChanges = Map.of();
}
