package com.oracle.lats.search;

import com.oracle.lats.core.CodeStrategy;
import com.oracle.lats.core.ExecutionResult;
import com.oracle.lats.search.model.MctsConfig;
import com.oracle.lats.search.model.SearchMetrics;
import com.oracle.lats.search.model.SearchResult;
import com.oracle.lats.search.model.TerminationState;
import com.oracle.lats.search.model.ThoughtNode;
import com.oracle.lats.search.model.WinningPath;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WinningPathExtractorTest {

    private final WinningPathExtractor extractor = new WinningPathExtractor(MctsConfig.builder().build());

    private static ThoughtNode strategyLeaf(ThoughtNode parent, String strategyId, double... rewards) {
        ThoughtNode leaf = parent.addChild(new ThoughtNode("step " + strategyId, "step " + strategyId));
        leaf.markTerminal(CodeStrategy.builder().strategyId(strategyId).fileChanges(Map.of("a.py", "x")).build());
        for (double reward : rewards) {
            leaf.updateQValue(reward);
            parent.updateQValue(reward);
        }
        return leaf;
    }

    @Test
    void bestLeafIsTheMostVisitedNotTheHighestQ() {
        ThoughtNode root = ThoughtNode.root("p");
        strategyLeaf(root, "lucky", 1.0);
        ThoughtNode steady = strategyLeaf(root, "steady", 0.7, 0.7, 0.7);

        assertThat(extractor.findBestLeaf(root)).contains(steady);
    }

    @Test
    void noStrategyMeansNoWinningPath() {
        ThoughtNode root = ThoughtNode.root("p");
        root.addChild(new ThoughtNode("a", "a")).updateQValue(0.9);

        assertThat(extractor.findBestLeaf(root)).isEmpty();
        assertThat(extractor.extract(root, "p", null, new SearchMetrics())).isEmpty();
        SearchResult result = extractor.buildResult(root, new SearchMetrics(), TerminationState.MAX_ITERATIONS);
        assertThat(result.getBestStrategyId()).isNull();
        assertThat(result.getBestScore()).isZero();
    }

    @Test
    void buildsScoresAndCounts() {
        ThoughtNode root = ThoughtNode.root("p");
        ThoughtNode good = strategyLeaf(root, "good", 0.8, 0.8, 0.8);
        good.setExecutionResult(ExecutionResult.builder().success(true).testsPassed(3).build());
        strategyLeaf(root, "weak", 0.2);

        SearchResult result = extractor.buildResult(root, new SearchMetrics(), TerminationState.EARLY_STOP);

        assertThat(result.getTotalGenerated()).isEqualTo(2);
        assertThat(result.getTotalExecuted()).isEqualTo(1);
        assertThat(result.getTotalPassed()).isEqualTo(1);
        assertThat(result.getBestStrategyId()).isEqualTo("good");
        assertThat(result.getScores().get("good").getConfidence()).isEqualTo(0.75);
        assertThat(result.getScores().get("good").getRecommendation()).isEqualTo("LATS selected");
        assertThat(result.getScores().get("weak").getRecommendation()).isEqualTo("Consider alternatives");
    }

    @Test
    void winningPathCarriesTraceAndVerdict() {
        ThoughtNode root = ThoughtNode.root("Fix the parser");
        ThoughtNode leaf = strategyLeaf(root, "s1", 0.4);
        leaf.setExecutionResult(ExecutionResult.builder().success(false).exitCode(1).testsPassed(1).testsFailed(1).build());
        SearchMetrics metrics = new SearchMetrics();
        metrics.setIterationsCompleted(7);

        WinningPath path = extractor.extract(root, "Fix the parser", null, metrics).orElseThrow();

        assertThat(path.getThoughtSequence()).containsExactly("Problem: Fix the parser", "step s1");
        assertThat(path.getProblemType()).isEqualTo("unknown");
        assertThat(path.getReflectionVerdict()).isEqualTo(WinningPathExtractor.VERDICT_REVISE);
        assertThat(path.getTotalIterations()).isEqualTo(7);
        assertThat(path.getExecutionResult()).containsEntry("test_pass_rate", 0.5).containsEntry("exit_code", 1);
        assertThat(path.getLatsConfig()).containsKeys("max_iterations", "max_depth");
    }
}
