package com.oracle.lats.core.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls structured data out of free-form model replies.
 */
class ModelResponseParser {

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?");

    private final ObjectMapper objectMapper = new ObjectMapper();

    // Accepts:
    // - pure JSON
    // - JSON inside ```json ...``` fences
    // - largest plausible {...} substring
    JsonNode extractJson(String response) throws Exception {
        String trimmed = response == null ? "" : response.trim();
        if (!trimmed.isEmpty() && trimmed.charAt(0) == '{') {
            try {
                return objectMapper.readTree(trimmed);
            } catch (Exception ignore) {
                // fall through to the lenient forms
            }
        }

        int fenceStart = trimmed.indexOf("```");
        while (fenceStart != -1) {
            int fenceEnd = trimmed.indexOf("```", fenceStart + 3);
            if (fenceEnd == -1) break;

            int headerEnd = trimmed.indexOf('\n', fenceStart + 3);
            String header = "";
            int contentStart;
            if (headerEnd != -1 && headerEnd < fenceEnd) {
                header = trimmed.substring(fenceStart + 3, headerEnd).trim().toLowerCase(Locale.ROOT);
                contentStart = headerEnd + 1;
            } else {
                contentStart = fenceStart + 3;
            }
            String code = trimmed.substring(contentStart, fenceEnd).trim();
            if (header.contains("json")) {
                try {
                    return objectMapper.readTree(code);
                } catch (Exception ignore) {
                    // try next fence
                }
            }
            fenceStart = trimmed.indexOf("```", fenceEnd + 3);
        }

        int firstBrace = trimmed.indexOf('{');
        int lastBrace = trimmed.lastIndexOf('}');
        while (firstBrace != -1 && lastBrace != -1 && lastBrace >= firstBrace) {
            String candidate = trimmed.substring(firstBrace, lastBrace + 1);
            try {
                return objectMapper.readTree(candidate);
            } catch (Exception ignore) {
                lastBrace = trimmed.lastIndexOf('}', lastBrace - 1);
            }
        }

        throw new IllegalArgumentException("No JSON object found in response");
    }

    /**
     * First fenced code block that is not JSON, as (language, code).
     */
    Optional<Map.Entry<String, String>> extractCodeFromFence(String response) {
        if (response == null) return Optional.empty();

        int idx = response.indexOf("```");
        while (idx != -1) {
            int end = response.indexOf("```", idx + 3);
            if (end == -1) break;

            int headerEnd = response.indexOf('\n', idx + 3);
            String lang = "";
            int contentStart;
            if (headerEnd != -1 && headerEnd < end) {
                lang = response.substring(idx + 3, headerEnd).trim().toLowerCase(Locale.ROOT);
                contentStart = headerEnd + 1;
            } else {
                contentStart = idx + 3;
            }
            String code = response.substring(contentStart, end).trim();
            if (!lang.contains("json") && !code.isEmpty()) {
                return Optional.of(Map.entry(lang, code));
            }
            idx = response.indexOf("```", end + 3);
        }
        return Optional.empty();
    }

    /**
     * First number in the reply, normalized to [0, 1]. Replies on a 0-10 scale are divided by ten.
     */
    Optional<Double> extractScore(String response) {
        if (response == null) return Optional.empty();
        Matcher matcher = NUMBER.matcher(response);
        if (!matcher.find()) {
            return Optional.empty();
        }
        double value = Double.parseDouble(matcher.group());
        if (value > 1.0 && value <= 10.0) {
            value = value / 10.0;
        }
        return Optional.of(Math.max(0.0, Math.min(1.0, value)));
    }

    static String abbreviate(String s, int maxLen) {
        if (s == null) return "null";
        if (maxLen <= 3) return s.length() <= maxLen ? s : s.substring(0, maxLen);
        return s.length() <= maxLen ? s : (s.substring(0, maxLen - 3) + "...");
    }
}
