package com.oracle.lats.search;

import com.oracle.lats.search.model.SearchMetrics;
import com.oracle.lats.search.model.ThoughtNode;
import lombok.Getter;

/**
 * A fatal failure inside an iteration. Carries the tree as it was when the run stopped;
 * nothing from the failed iteration is rolled back.
 */
@Getter
public class SearchAbortedException extends RuntimeException {

    private final int iteration;

    private final transient ThoughtNode partialTree;

    private final transient SearchMetrics metrics;

    public SearchAbortedException(String message, Throwable cause, int iteration,
                                  ThoughtNode partialTree, SearchMetrics metrics) {
        super(message, cause);
        this.iteration = iteration;
        this.partialTree = partialTree;
        this.metrics = metrics;
    }
}
