package com.oracle.lats.evaluation;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based quality estimate of a thought, independent of any model call.
 */
@Component
public class ThoughtHeuristics {

    static final double BASE_SCORE = 0.5;

    private static final List<String> ACTION_KEYWORDS = List.of(
            "add", "remove", "replace", "refactor", "extract", "rename", "implement", "fix",
            "validate", "check", "handle", "test", "update", "create", "move", "call", "return");

    private static final Pattern CODE_FENCE = Pattern.compile("```([\\w+#-]*)[ \\t]*\\n?(.*?)```", Pattern.DOTALL);

    private static final Pattern SEQUENCE_MARKERS = Pattern.compile(
            "(?i)\\b(first|second|third|then|next|finally|after that|step\\s*\\d+)\\b|(^|\\n)\\s*\\d+[.)]\\s");

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}_]+");

    private final SnippetSyntaxChecker syntaxChecker;

    @Autowired
    public ThoughtHeuristics(SnippetSyntaxChecker syntaxChecker) {
        this.syntaxChecker = syntaxChecker;
    }

    public ThoughtHeuristics() {
        this(new BracketBalanceChecker());
    }

    public double score(String thought) {
        if (thought == null) {
            return 0.0;
        }
        double score = BASE_SCORE;

        int words = thought.isBlank() ? 0 : thought.trim().split("\\s+").length;
        if (words >= 5 && words <= 50) {
            score += 0.1;
        } else if (words < 3) {
            score -= 0.2;
        }

        score += Math.min(countActionKeywords(thought), 4) * 0.05;

        Matcher fence = CODE_FENCE.matcher(thought);
        while (fence.find()) {
            score += syntaxChecker.isWellFormed(fence.group(1), fence.group(2)) ? 0.1 : -0.1;
        }

        if (SEQUENCE_MARKERS.matcher(thought).find()) {
            score += 0.1;
        }

        return Math.max(0.0, Math.min(1.0, score));
    }

    static int countActionKeywords(String thought) {
        int matches = 0;
        Matcher word = WORD.matcher(thought.toLowerCase(Locale.ROOT));
        while (word.find()) {
            if (ACTION_KEYWORDS.contains(word.group())) {
                matches++;
            }
        }
        return matches;
    }
}
