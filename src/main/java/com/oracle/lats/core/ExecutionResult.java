package com.oracle.lats.core;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ExecutionResult {

    boolean success;

    int exitCode;

    String stdout;

    String stderr;

    int testsPassed;

    int testsFailed;

    long executionTimeMs;

    public double testPassRate() {
        int total = testsPassed + testsFailed;
        if (total == 0) {
            return success ? 1.0 : 0.0;
        }
        return (double) testsPassed / total;
    }
}
