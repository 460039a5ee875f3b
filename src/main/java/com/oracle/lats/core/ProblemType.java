package com.oracle.lats.core;

import java.util.Locale;

public enum ProblemType {
    BUG_FIX,
    FEATURE,
    REFACTOR,
    PERFORMANCE,
    SECURITY,
    TEST,
    OTHER;

    /**
     * Lenient lookup: accepts "bug_fix", "bug-fix", "BUG_FIX"; anything unknown maps to OTHER.
     */
    public static ProblemType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (ProblemType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return OTHER;
    }
}
