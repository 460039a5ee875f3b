package com.oracle.lats.search.model;

import com.oracle.lats.core.CodeStrategy;
import com.oracle.lats.core.ExecutionResult;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * A vertex of the search tree. Holds one partial thought plus the MCTS statistics
 * accumulated for it. Children are owned and kept in insertion order; the parent
 * link is a plain back-reference.
 */
@Getter
public class ThoughtNode {

    public static final String ROOT_ID = "root";

    private static final double EPSILON = 1e-6;
    private static final int MAX_SUMMARY_CHARS = 600;
    private static final int MAX_PROBLEM_CHARS = 500;
    private static final int MAX_STEP_CHARS = 150;
    private static final int SUMMARY_STEPS = 3;

    private String id;

    private ThoughtNode parent;

    private final List<ThoughtNode> children = new ArrayList<>();

    private int depth;

    private final String partialThought;

    private final String thoughtDiff;

    private int visitCount;

    private double qValue;

    private double thoughtScore;

    private boolean thoughtScored;

    @Setter
    private boolean promising;

    private boolean terminal;

    private CodeStrategy completedStrategy;

    @Setter
    private ExecutionResult executionResult;

    private final List<String> rejectedReasons = new ArrayList<>();

    public ThoughtNode(String partialThought, String thoughtDiff) {
        this.partialThought = partialThought == null ? "" : partialThought;
        this.thoughtDiff = thoughtDiff == null ? this.partialThought : thoughtDiff;
    }

    public static ThoughtNode root(String problem) {
        ThoughtNode root = new ThoughtNode("Problem: " + problem, "");
        root.id = ROOT_ID;
        root.depth = 0;
        return root;
    }

    /**
     * Attaches {@code child} as the last child of this node. The child's id and depth are
     * derived from this node; a child can be attached only once.
     */
    public ThoughtNode addChild(ThoughtNode child) {
        if (child.parent != null || ROOT_ID.equals(child.id)) {
            throw new IllegalArgumentException("Node " + child.id + " is already attached to a tree");
        }
        child.parent = this;
        child.depth = depth + 1;
        child.id = id + "-" + children.size();
        children.add(child);
        return child;
    }

    public List<ThoughtNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<String> getRejectedReasons() {
        return Collections.unmodifiableList(rejectedReasons);
    }

    public boolean isRoot() {
        return parent == null;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public double ucb(double explorationConstant) {
        int parentVisits = parent == null ? 0 : parent.visitCount;
        double exploration = Math.sqrt(Math.log(parentVisits + 1) / (visitCount + EPSILON));
        return qValue + explorationConstant * exploration;
    }

    /**
     * Incremental mean: after n updates qValue equals the arithmetic mean of the n rewards.
     */
    public void updateQValue(double reward) {
        visitCount++;
        qValue += (reward - qValue) / visitCount;
    }

    public void setThoughtScore(double thoughtScore) {
        this.thoughtScore = thoughtScore;
        this.thoughtScored = true;
    }

    public void markTerminal(CodeStrategy strategy) {
        this.completedStrategy = strategy;
        this.terminal = true;
    }

    public void addRejectionReason(String reason) {
        rejectedReasons.add(reason);
    }

    public boolean hasCompletedStrategy() {
        return completedStrategy != null;
    }

    /**
     * Root to this node, inclusive.
     */
    public List<String> getFullPath() {
        Deque<String> path = new ArrayDeque<>();
        for (ThoughtNode node = this; node != null; node = node.parent) {
            path.addFirst(node.partialThought);
        }
        return new ArrayList<>(path);
    }

    /**
     * Short projection of this node used in prompts instead of the whole path.
     */
    public String getSummary() {
        if (isRoot()) {
            return abbreviate(partialThought, MAX_PROBLEM_CHARS);
        }

        Deque<ThoughtNode> recent = new ArrayDeque<>();
        for (ThoughtNode node = this; node != null && !node.isRoot() && recent.size() < SUMMARY_STEPS;
             node = node.parent) {
            recent.addFirst(node);
        }

        StringBuilder summary = new StringBuilder();
        summary.append(String.format("Depth %d | Q=%.2f | visits=%d", depth, qValue, visitCount));
        for (ThoughtNode step : recent) {
            summary.append("\nStep ").append(step.depth).append(": ")
                    .append(abbreviate(step.thoughtDiff, MAX_STEP_CHARS));
        }
        return abbreviate(summary.toString(), MAX_SUMMARY_CHARS);
    }

    private static String abbreviate(String s, int maxLen) {
        if (s == null) return "";
        return s.length() <= maxLen ? s : (s.substring(0, maxLen - 3) + "...");
    }

    @Override
    public String toString() {
        return String.format("ThoughtNode[%s depth=%d visits=%d q=%.3f terminal=%s]",
                id, depth, visitCount, qValue, terminal);
    }
}
