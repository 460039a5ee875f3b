package com.oracle.lats.search.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ThoughtNodeTest {

    @Test
    void childIdsFollowInsertionOrder() {
        ThoughtNode root = ThoughtNode.root("Fix the parser");
        ThoughtNode first = root.addChild(new ThoughtNode("a", "a"));
        ThoughtNode second = root.addChild(new ThoughtNode("b", "b"));
        ThoughtNode grandchild = second.addChild(new ThoughtNode("c", "c"));

        assertThat(root.getId()).isEqualTo(ThoughtNode.ROOT_ID);
        assertThat(first.getId()).isEqualTo("root-0");
        assertThat(second.getId()).isEqualTo("root-1");
        assertThat(grandchild.getId()).isEqualTo("root-1-0");
        assertThat(grandchild.getDepth()).isEqualTo(2);
        assertThat(grandchild.getParent()).isSameAs(second);
    }

    @Test
    void nodeCannotBeAttachedTwice() {
        ThoughtNode root = ThoughtNode.root("p");
        ThoughtNode child = root.addChild(new ThoughtNode("a", "a"));

        assertThatThrownBy(() -> root.addChild(child)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> root.addChild(ThoughtNode.root("other"))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void qValueIsTheRunningMean() {
        ThoughtNode node = new ThoughtNode("a", "a");
        node.updateQValue(1.0);
        node.updateQValue(0.0);
        node.updateQValue(0.5);

        assertThat(node.getVisitCount()).isEqualTo(3);
        assertThat(node.getQValue()).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void ucbFavoursRarelyVisitedChildren() {
        ThoughtNode root = ThoughtNode.root("p");
        ThoughtNode often = root.addChild(new ThoughtNode("a", "a"));
        ThoughtNode rarely = root.addChild(new ThoughtNode("b", "b"));
        for (int i = 0; i < 9; i++) {
            often.updateQValue(0.5);
            root.updateQValue(0.5);
        }
        rarely.updateQValue(0.5);
        root.updateQValue(0.5);

        assertThat(rarely.ucb(1.4)).isGreaterThan(often.ucb(1.4));
        double expected = 0.5 + 1.4 * Math.sqrt(Math.log(11) / (9 + 1e-6));
        assertThat(often.ucb(1.4)).isCloseTo(expected, within(1e-9));
        assertThat(often.ucb(0.0)).isEqualTo(0.5);
    }

    @Test
    void fullPathRunsFromRoot() {
        ThoughtNode root = ThoughtNode.root("p");
        ThoughtNode leaf = root.addChild(new ThoughtNode("a", "a")).addChild(new ThoughtNode("b", "b"));

        assertThat(leaf.getFullPath()).containsExactly("Problem: p", "a", "b");
    }

    @Test
    void summaryKeepsTheLastThreeStepsAndIsBounded() {
        ThoughtNode node = ThoughtNode.root("p");
        for (int i = 1; i <= 5; i++) {
            String step = "step" + i + " " + "x".repeat(300);
            node = node.addChild(new ThoughtNode(step, step));
        }

        String summary = node.getSummary();

        assertThat(summary).startsWith("Depth 5 |");
        assertThat(summary).contains("Step 5: step5").contains("Step 3: step3").doesNotContain("step2");
        assertThat(summary.length()).isLessThanOrEqualTo(600);
        assertThat(ThoughtNode.root("y".repeat(1000)).getSummary()).hasSize(500).endsWith("...");
    }

    @Test
    void markTerminalKeepsTheStrategy() {
        ThoughtNode node = new ThoughtNode("a", "a");
        assertThat(node.hasCompletedStrategy()).isFalse();

        node.markTerminal(com.oracle.lats.core.CodeStrategy.builder().strategyId("s").build());

        assertThat(node.isTerminal()).isTrue();
        assertThat(node.getCompletedStrategy().getStrategyId()).isEqualTo("s");
    }
}
