package com.oracle.lats.search.model;

public enum LatsEventType {
    SEARCH_START,
    ITERATION_START,
    SELECTION,
    EXPANSION,
    SIMULATION_START,
    SIMULATION_END,
    BACKPROPAGATION,
    BUDGET_CHECK,
    EARLY_GIVEUP,
    EARLY_STOP,
    CANCELLED,
    SEARCH_END
}
