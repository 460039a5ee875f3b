package com.oracle.lats.search.model;

public enum TerminationState {
    RUNNING,
    CANCELLED,
    BUDGET_EXCEEDED,
    EARLY_GIVEUP,
    EARLY_STOP,
    MAX_ITERATIONS;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
