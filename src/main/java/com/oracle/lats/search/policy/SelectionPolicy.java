package com.oracle.lats.search.policy;

import com.oracle.lats.search.model.ThoughtNode;

public interface SelectionPolicy {

    /**
     * Walks from {@code root} to the node the next iteration should work on. Must not mutate the tree.
     */
    ThoughtNode select(ThoughtNode root);
}
