package com.oracle.lats.evaluation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ThoughtHeuristicsTest {

    private final ThoughtHeuristics heuristics = new ThoughtHeuristics();

    @Test
    void shortVagueThoughtScoresLow() {
        assertThat(heuristics.score("maybe")).isCloseTo(0.3, within(1e-9));
        assertThat(heuristics.score(null)).isZero();
    }

    @Test
    void concreteOrderedPlanScoresHigh() {
        String thought = "First add a null check to the parser, then update the caller and test the edge case.";

        // base 0.5 + length 0.1 + keywords (add, check, update, test) 0.2 + sequence 0.1
        assertThat(heuristics.score(thought)).isCloseTo(0.9, within(1e-9));
    }

    @Test
    void keywordBonusIsCapped() {
        String thought = "add remove replace refactor extract rename implement fix";

        assertThat(ThoughtHeuristics.countActionKeywords(thought)).isEqualTo(8);
        assertThat(heuristics.score(thought)).isCloseTo(0.5 + 0.1 + 0.2, within(1e-9));
    }

    @Test
    void codeFencesAreCheckedForBalance() {
        String good = "Use this helper:\n```python\ndef f(xs):\n    return [x for x in xs]\n```";
        String bad = "Use this helper:\n```python\ndef f(xs:\n    return [x for x in xs\n```";

        assertThat(heuristics.score(good) - heuristics.score(bad)).isCloseTo(0.2, within(1e-9));
    }

    @Test
    void usesTheInjectedChecker() {
        ThoughtHeuristics rejecting = new ThoughtHeuristics((language, code) -> false);
        String thought = "Replace it with:\n```java\nint x = 1;\n```";

        assertThat(rejecting.score(thought)).isLessThan(heuristics.score(thought));
    }
}
