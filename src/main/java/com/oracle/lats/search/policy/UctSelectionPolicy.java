package com.oracle.lats.search.policy;

import com.oracle.lats.search.model.ThoughtNode;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * UCT descent. Unvisited children are taken first, in insertion order; among visited
 * children the highest UCB1 wins and the first one seen wins a tie.
 */
@Slf4j
public class UctSelectionPolicy implements SelectionPolicy {

    private final int maxDepth;
    private final double explorationConstant;

    public UctSelectionPolicy(int maxDepth, double explorationConstant) {
        this.maxDepth = maxDepth;
        this.explorationConstant = explorationConstant;
    }

    @Override
    public ThoughtNode select(ThoughtNode root) {
        ThoughtNode node = root;
        while (!node.isLeaf() && node.getDepth() < maxDepth) {
            node = selectChild(node.getChildren());
        }
        log.debug("Selected node: {} (depth={}, visits={}, q={})",
                node.getId(), node.getDepth(), node.getVisitCount(), node.getQValue());
        return node;
    }

    private ThoughtNode selectChild(List<ThoughtNode> children) {
        for (ThoughtNode child : children) {
            if (child.getVisitCount() == 0) {
                return child;
            }
        }

        ThoughtNode best = children.get(0);
        double bestScore = best.ucb(explorationConstant);
        for (int i = 1; i < children.size(); i++) {
            ThoughtNode child = children.get(i);
            double score = child.ucb(explorationConstant);
            if (score > bestScore) {
                best = child;
                bestScore = score;
            }
        }
        return best;
    }
}
