package com.oracle.lats.search;

import com.oracle.lats.search.model.ThoughtNode;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns failed rollouts into short verbal reasons and hands them to the parent node,
 * where sibling expansions pick them up as guidance.
 */
@Slf4j
public class ReflexionPropagator {

    public static final String UNKNOWN_FAILURE = "Unknown failure";

    static final int MAX_CONTEXT_REASONS = 5;
    static final int MAX_RAW_REASON_CHARS = 100;
    static final double LOW_THOUGHT_SCORE = 0.5;
    static final double LOW_Q_VALUE = 0.3;

    private static final List<ErrorPattern> KNOWN_ERRORS = List.of(
            new ErrorPattern("Index out of range - check list/array bounds",
                    "indexerror", "index out of range", "indexoutofbounds", "list index"),
            new ErrorPattern("Type mismatch - check argument and return types",
                    "typeerror", "classcastexception", "incompatible types", "unsupported operand"),
            new ErrorPattern("Missing attribute - referenced a field or method that does not exist",
                    "attributeerror", "has no attribute", "nosuchmethod", "nosuchfield"),
            new ErrorPattern("Missing module - import a dependency that is available",
                    "modulenotfounderror", "no module named", "importerror", "classnotfoundexception",
                    "package does not exist"),
            new ErrorPattern("Syntax error - generated code does not parse",
                    "syntaxerror", "invalid syntax", "unexpected token", "expected ';'"),
            new ErrorPattern("Undefined name - variable or function used before definition",
                    "nameerror", "is not defined", "cannot find symbol", "undefined")
    );

    public String extractFailureReason(ThoughtNode node, String rawError) {
        if (rawError != null && !rawError.isBlank()) {
            String lower = rawError.toLowerCase(Locale.ROOT);
            for (ErrorPattern pattern : KNOWN_ERRORS) {
                if (pattern.matches(lower)) {
                    return pattern.reason;
                }
            }
            String trimmed = rawError.strip();
            return trimmed.length() <= MAX_RAW_REASON_CHARS ? trimmed : trimmed.substring(0, MAX_RAW_REASON_CHARS);
        }

        if (!node.isTerminal() && node.isThoughtScored() && node.getThoughtScore() < LOW_THOUGHT_SCORE) {
            return String.format("Low thought quality (score %.2f): %s",
                    node.getThoughtScore(), abbreviate(node.getThoughtDiff(), 60));
        }
        if (node.getVisitCount() > 0 && node.getQValue() < LOW_Q_VALUE) {
            return String.format("Low value estimate (Q=%.2f) after %d visits", node.getQValue(), node.getVisitCount());
        }
        return UNKNOWN_FAILURE;
    }

    public void propagateToParent(ThoughtNode node, String reason) {
        ThoughtNode parent = node.getParent();
        if (parent == null) {
            return;
        }
        parent.addRejectionReason(reason);
        log.debug("Reflexion {} -> {}: {}", node.getId(), parent.getId(), reason);
    }

    /**
     * Guidance text listing what already failed under the given nodes, merged in argument order
     * and deduplicated; empty when nothing did. Null nodes are skipped.
     */
    public String getRejectionContext(ThoughtNode... nodes) {
        Set<String> unique = new LinkedHashSet<>();
        if (nodes != null) {
            for (ThoughtNode node : nodes) {
                if (node != null) {
                    unique.addAll(node.getRejectedReasons());
                }
            }
        }
        if (unique.isEmpty()) {
            return "";
        }
        StringBuilder context = new StringBuilder("Previously rejected approaches (avoid repeating these mistakes):\n");
        unique.stream()
                .limit(MAX_CONTEXT_REASONS)
                .forEach(reason -> context.append("- ").append(reason).append('\n'));
        return context.toString();
    }

    private static String abbreviate(String s, int maxLen) {
        if (s == null) return "";
        return s.length() <= maxLen ? s : (s.substring(0, maxLen - 3) + "...");
    }

    private static final class ErrorPattern {
        final String reason;
        final String[] needles;

        ErrorPattern(String reason, String... needles) {
            this.reason = reason;
            this.needles = needles;
        }

        boolean matches(String lowerError) {
            for (String needle : needles) {
                if (lowerError.contains(needle)) {
                    return true;
                }
            }
            return false;
        }
    }
}
