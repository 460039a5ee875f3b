package com.oracle.lats.core.impl;

import com.oracle.lats.core.CodeStrategy;
import com.oracle.lats.core.ExecutionResult;
import com.oracle.lats.core.StrategyEvaluation;
import com.oracle.lats.core.StrategyScorer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores a strategy from how its execution went: clean exit, test pass rate, and whether it changed anything.
 */
@Component
public class ExecutionOutcomeScorer implements StrategyScorer {

    static final double EXIT_WEIGHT = 0.3;
    static final double TESTS_WEIGHT = 0.6;
    static final double CHANGES_WEIGHT = 0.1;

    @Override
    public StrategyEvaluation score(CodeStrategy strategy, ExecutionResult result) {
        List<String> weaknesses = new ArrayList<>();
        double score = 0.0;

        if (result.getExitCode() == 0) {
            score += EXIT_WEIGHT;
        } else {
            weaknesses.add("exit code " + result.getExitCode());
        }

        double passRate = result.testPassRate();
        score += TESTS_WEIGHT * passRate;
        if (result.getTestsFailed() > 0) {
            weaknesses.add(result.getTestsFailed() + " failing test(s)");
        } else if (result.getTestsPassed() == 0 && !result.isSuccess()) {
            weaknesses.add("no tests passed");
        }

        if (strategy.getFileChanges() != null && !strategy.getFileChanges().isEmpty()) {
            score += CHANGES_WEIGHT;
        } else {
            weaknesses.add("no file changes");
        }

        return StrategyEvaluation.builder()
                .totalScore(Math.max(0.0, Math.min(1.0, score)))
                .weaknesses(String.join("; ", weaknesses))
                .build();
    }
}
