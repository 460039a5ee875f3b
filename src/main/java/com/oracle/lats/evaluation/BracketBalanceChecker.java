package com.oracle.lats.evaluation;

import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Language-agnostic check: brackets must nest and close, string literals must terminate.
 * Not a parser; a snippet that passes can still fail to compile.
 */
@Component
public class BracketBalanceChecker implements SnippetSyntaxChecker {

    @Override
    public boolean isWellFormed(String language, String code) {
        if (code == null || code.isBlank()) {
            return false;
        }
        Deque<Character> open = new ArrayDeque<>();
        char quote = 0;
        boolean escaped = false;
        boolean lineComment = false;

        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);

            if (lineComment) {
                if (c == '\n') lineComment = false;
                continue;
            }
            if (quote != 0) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == quote) {
                    quote = 0;
                } else if (c == '\n' && quote != '`') {
                    // single-line literal ran off the end of the line
                    return false;
                }
                continue;
            }

            switch (c) {
                case '"', '\'', '`' -> {
                    if (isTripleQuote(code, i, c)) {
                        int end = code.indexOf(String.valueOf(c).repeat(3), i + 3);
                        if (end < 0) return false;
                        i = end + 2;
                    } else {
                        quote = c;
                    }
                }
                case '#' -> lineComment = isHashComment(language);
                case '/' -> {
                    if (!isPython(language) && i + 1 < code.length() && code.charAt(i + 1) == '/') lineComment = true;
                }
                case '(', '[', '{' -> open.push(c);
                case ')' -> {
                    if (open.isEmpty() || open.pop() != '(') return false;
                }
                case ']' -> {
                    if (open.isEmpty() || open.pop() != '[') return false;
                }
                case '}' -> {
                    if (open.isEmpty() || open.pop() != '{') return false;
                }
                default -> {
                }
            }
        }
        return quote == 0 && open.isEmpty();
    }

    private static boolean isTripleQuote(String code, int i, char c) {
        return c != '`' && i + 2 < code.length() && code.charAt(i + 1) == c && code.charAt(i + 2) == c;
    }

    private static boolean isPython(String language) {
        return language != null && language.toLowerCase().startsWith("py");
    }

    private static boolean isHashComment(String language) {
        if (language == null || language.isBlank()) {
            return true;
        }
        String lang = language.toLowerCase();
        return lang.startsWith("py") || lang.equals("bash") || lang.equals("sh") || lang.equals("ruby")
                || lang.equals("yaml");
    }
}
