package com.oracle.lats.search;

import com.oracle.lats.search.model.ThoughtNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Breadth-first tree utilities. Work-list based, so deep trees do not grow the call stack.
 */
public final class TreeWalker {

    private TreeWalker() {
    }

    public static List<ThoughtNode> leaves(ThoughtNode root) {
        List<ThoughtNode> leaves = new ArrayList<>();
        for (ThoughtNode node : breadthFirst(root)) {
            if (node.isLeaf()) {
                leaves.add(node);
            }
        }
        return leaves;
    }

    public static List<ThoughtNode> breadthFirst(ThoughtNode root) {
        List<ThoughtNode> ordered = new ArrayList<>();
        Deque<ThoughtNode> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            ThoughtNode current = queue.poll();
            ordered.add(current);
            queue.addAll(current.getChildren());
        }
        return ordered;
    }

    public static int countNodes(ThoughtNode root) {
        return breadthFirst(root).size();
    }

    public static int maxDepth(ThoughtNode root) {
        int max = root.getDepth();
        for (ThoughtNode node : breadthFirst(root)) {
            max = Math.max(max, node.getDepth());
        }
        return max;
    }
}
