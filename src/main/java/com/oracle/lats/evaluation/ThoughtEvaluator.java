package com.oracle.lats.evaluation;

import com.oracle.lats.core.ThoughtEvaluation;
import com.oracle.lats.core.ThoughtJudge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Hybrid score of an intermediate thought: 40% heuristics, 60% model judge.
 * Never throws; a failing or silent judge counts as a neutral 0.5 and the result is marked degraded.
 */
@Component
@Slf4j
public class ThoughtEvaluator {

    static final double HEURISTIC_WEIGHT = 0.4;
    static final double JUDGE_WEIGHT = 0.6;
    static final double NEUTRAL_SCORE = 0.5;

    private final ThoughtHeuristics heuristics;
    private final ThoughtJudge judge;

    public ThoughtEvaluator(ThoughtHeuristics heuristics, ThoughtJudge judge) {
        this.heuristics = heuristics;
        this.judge = judge;
    }

    public ThoughtEvaluation evaluate(String thought) {
        double heuristic = heuristics.score(thought);
        Double judged = judgeOrNull(thought);
        double judgeScore = judged == null ? NEUTRAL_SCORE : judged;
        double score = Math.max(0.0, Math.min(1.0, HEURISTIC_WEIGHT * heuristic + JUDGE_WEIGHT * judgeScore));
        log.debug("Thought score {} (heuristic={}, judge={})", score, heuristic, judged);
        return judged == null ? ThoughtEvaluation.degraded(score) : ThoughtEvaluation.of(score);
    }

    private Double judgeOrNull(String thought) {
        if (judge == null) {
            return null;
        }
        try {
            double judged = judge.judge(thought);
            if (Double.isNaN(judged)) {
                return null;
            }
            return Math.max(0.0, Math.min(1.0, judged));
        } catch (Exception e) {
            log.warn("Thought judge failed, using neutral score: {}", e.getMessage());
            return null;
        }
    }
}
