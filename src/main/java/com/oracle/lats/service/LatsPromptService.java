package com.oracle.lats.service;

import com.oracle.lats.search.ExpansionEngine;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class LatsPromptService {

    private static final int MAX_CONTEXT_VALUE_CHARS = 2000;

    public String createSystemPrompt() {
        return """
            You are a senior software engineer planning a code change step by step.
            You explore alternative approaches, and each answer you give is one node of a search tree:
            either a short next reasoning step, or a complete implementation of an already chosen path.

            IMPORTANT OUTPUT REQUIREMENTS:
            - Respond ONLY with a single valid JSON object.
            - Do NOT include prose before or after the JSON.
            """;
    }

    public String createNextThoughtsPrompt(String currentState, String problem, Map<String, Object> context, int k) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("PROBLEM:\n").append(problem).append("\n\n");
        appendContext(prompt, context);

        prompt.append("CURRENT STATE:\n").append(currentState).append("\n\n");
        appendRejections(prompt, context);

        prompt.append("Propose ").append(k).append(" distinct next steps that move the current state towards a solution.\n");
        prompt.append("Each step must be concrete (what to change, where and why) and differ from the others in approach.\n");
        prompt.append("Keep every step under 50 words.\n\n");
        prompt.append("Respond in the following JSON format:\n");
        prompt.append("{\n");
        prompt.append("  \"thoughts\": [\"step 1\", \"step 2\", ...]\n");
        prompt.append("}\n");

        return prompt.toString();
    }

    public String createStrategyPrompt(List<String> thoughtPath, String problem, Map<String, Object> context) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("PROBLEM:\n").append(problem).append("\n\n");
        appendContext(prompt, context);

        prompt.append("CHOSEN REASONING PATH:\n");
        for (int i = 0; i < thoughtPath.size(); i++) {
            prompt.append(i + 1).append(". ").append(thoughtPath.get(i)).append("\n");
        }
        prompt.append("\n");
        appendRejections(prompt, context);

        prompt.append("Implement the reasoning path above as a complete code change.\n");
        prompt.append("Give the full new content of every file you touch, including tests where relevant.\n\n");
        prompt.append("Respond in the following JSON format:\n");
        prompt.append("{\n");
        prompt.append("  \"title\": \"short name of the strategy\",\n");
        prompt.append("  \"description\": \"what the change does\",\n");
        prompt.append("  \"file_changes\": {\"path/to/file\": \"full file content\", ...}\n");
        prompt.append("}\n");

        return prompt.toString();
    }

    public String createJudgePrompt(String thought) {
        return """
            You are a critical reviewer of software engineering plans.
            Rate the following reasoning step for correctness, concreteness and likelihood of leading to a working fix.
            Be strict: vague or risky steps score low.

            STEP:
            %s

            Respond with a single number between 0.0 and 1.0 and nothing else.
            """.formatted(thought);
    }

    private void appendContext(StringBuilder prompt, Map<String, Object> context) {
        if (context == null || context.isEmpty()) {
            return;
        }
        StringBuilder rendered = new StringBuilder();
        context.forEach((key, value) -> {
            if (value == null || ExpansionEngine.REJECTION_CONTEXT_KEY.equals(key)) {
                return;
            }
            String text = value.toString();
            if (text.isBlank()) {
                return;
            }
            if (text.length() > MAX_CONTEXT_VALUE_CHARS) {
                text = text.substring(0, MAX_CONTEXT_VALUE_CHARS) + "...";
            }
            rendered.append("- ").append(key).append(": ").append(text).append("\n");
        });
        if (!rendered.isEmpty()) {
            prompt.append("CONTEXT:\n").append(rendered).append("\n");
        }
    }

    private void appendRejections(StringBuilder prompt, Map<String, Object> context) {
        if (context == null) {
            return;
        }
        Object rejections = context.get(ExpansionEngine.REJECTION_CONTEXT_KEY);
        if (rejections != null && !rejections.toString().isBlank()) {
            prompt.append(rejections).append("\n\n");
        }
    }
}
