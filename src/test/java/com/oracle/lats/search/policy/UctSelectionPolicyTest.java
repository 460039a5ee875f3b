package com.oracle.lats.search.policy;

import com.oracle.lats.search.model.ThoughtNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UctSelectionPolicyTest {

    private final UctSelectionPolicy policy = new UctSelectionPolicy(5, 1.4);

    @Test
    void unexpandedRootIsSelected() {
        ThoughtNode root = ThoughtNode.root("p");

        assertThat(policy.select(root)).isSameAs(root);
    }

    @Test
    void firstUnvisitedChildWins() {
        ThoughtNode root = ThoughtNode.root("p");
        ThoughtNode visited = root.addChild(new ThoughtNode("a", "a"));
        ThoughtNode firstUnvisited = root.addChild(new ThoughtNode("b", "b"));
        root.addChild(new ThoughtNode("c", "c"));
        visited.updateQValue(1.0);
        root.updateQValue(1.0);

        assertThat(policy.select(root)).isSameAs(firstUnvisited);
    }

    @Test
    void tieGoesToTheFirstChild() {
        ThoughtNode root = ThoughtNode.root("p");
        ThoughtNode a = root.addChild(new ThoughtNode("a", "a"));
        ThoughtNode b = root.addChild(new ThoughtNode("b", "b"));
        a.updateQValue(0.5);
        b.updateQValue(0.5);
        root.updateQValue(0.5);
        root.updateQValue(0.5);

        assertThat(policy.select(root)).isSameAs(a);
    }

    @Test
    void descendsByHighestUcb() {
        ThoughtNode root = ThoughtNode.root("p");
        ThoughtNode weak = root.addChild(new ThoughtNode("a", "a"));
        ThoughtNode strong = root.addChild(new ThoughtNode("b", "b"));
        ThoughtNode grandchild = strong.addChild(new ThoughtNode("c", "c"));
        weak.updateQValue(0.1);
        strong.updateQValue(0.9);
        grandchild.updateQValue(0.9);
        root.updateQValue(0.1);
        root.updateQValue(0.9);

        assertThat(policy.select(root)).isSameAs(grandchild);
    }

    @Test
    void stopsAtMaxDepth() {
        UctSelectionPolicy shallow = new UctSelectionPolicy(1, 1.4);
        ThoughtNode root = ThoughtNode.root("p");
        ThoughtNode child = root.addChild(new ThoughtNode("a", "a"));
        child.addChild(new ThoughtNode("b", "b"));

        assertThat(shallow.select(root)).isSameAs(child);
    }
}
