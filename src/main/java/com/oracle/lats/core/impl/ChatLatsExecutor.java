package com.oracle.lats.core.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.oracle.lats.config.LatsConfig;
import com.oracle.lats.core.CodeStrategy;
import com.oracle.lats.core.ExecutionResult;
import com.oracle.lats.core.LatsExecutionException;
import com.oracle.lats.core.LatsExecutor;
import com.oracle.lats.core.ThoughtEvaluation;
import com.oracle.lats.evaluation.ThoughtEvaluator;
import com.oracle.lats.service.LatsPromptService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * {@link LatsExecutor} backed by a Spring AI {@link ChatClient} and the process sandbox.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChatLatsExecutor implements LatsExecutor {

    private static final Pattern LIST_MARKER = Pattern.compile("^\\s*(?:[-*•]|\\d+[.)])\\s+");

    private final ChatClient.Builder chatClientBuilder;
    private volatile ChatClient chatClient;
    private final LatsPromptService promptService;
    private final ThoughtEvaluator thoughtEvaluator;
    private final ProcessSandbox sandbox;
    private final LatsConfig latsConfig;
    private final ModelResponseParser parser = new ModelResponseParser();

    @Override
    public List<String> generateNextThoughts(String currentState, String problem, Map<String, Object> context, int k) {
        String prompt = promptService.createNextThoughtsPrompt(currentState, problem, context, k);
        String response = call(prompt, latsConfig.getTemperatureExpansion(), latsConfig.getGeneratorModel());

        List<String> thoughts = parseThoughts(response);
        if (thoughts.size() > k) {
            thoughts = thoughts.subList(0, k);
        }
        log.debug("Generated {} thoughts", thoughts.size());
        return thoughts;
    }

    @Override
    public CodeStrategy generateCompleteStrategy(List<String> thoughtPath, String problem, Map<String, Object> context) {
        String prompt = promptService.createStrategyPrompt(thoughtPath, problem, context);
        String response = call(prompt, latsConfig.getTemperatureSimulation(), latsConfig.getGeneratorModel());
        return parseStrategy(response);
    }

    @Override
    public ExecutionResult executeStrategy(CodeStrategy strategy) {
        return sandbox.execute(strategy);
    }

    @Override
    public ThoughtEvaluation evaluateThought(String partialThought) {
        return thoughtEvaluator.evaluate(partialThought);
    }

    private String call(String prompt, double temperature, String model) {
        ensureClient();
        ChatOptions options = ChatOptions.builder()
                .model(model)
                .temperature(temperature)
                .build();
        try {
            return chatClient.prompt()
                    .user(prompt)
                    .options(options)
                    .call()
                    .content();
        } catch (Exception e) {
            throw new LatsExecutionException("Model call failed: " + e.getMessage(), e);
        }
    }

    private void ensureClient() {
        if (this.chatClient == null) {
            synchronized (this) {
                if (this.chatClient == null) {
                    this.chatClient = chatClientBuilder
                            .defaultSystem(promptService.createSystemPrompt())
                            .build();
                }
            }
        }
    }

    List<String> parseThoughts(String response) {
        List<String> thoughts = new ArrayList<>();
        try {
            JsonNode node = parser.extractJson(response);
            JsonNode array = node.has("thoughts") ? node.get("thoughts") : node.get("steps");
            if (array != null && array.isArray()) {
                array.forEach(item -> {
                    String text = item.isTextual() ? item.asText() : item.toString();
                    if (!text.isBlank()) {
                        thoughts.add(text.trim());
                    }
                });
                return thoughts;
            }
        } catch (Exception e) {
            log.warn("Invalid thoughts response (non-JSON). Falling back to list parsing. Snippet: {}",
                    ModelResponseParser.abbreviate(response, 400));
        }

        // one thought per bulleted or numbered line
        if (response != null) {
            for (String line : response.split("\\R")) {
                if (LIST_MARKER.matcher(line).find()) {
                    String text = LIST_MARKER.matcher(line).replaceFirst("").trim();
                    if (!text.isEmpty()) {
                        thoughts.add(text);
                    }
                }
            }
        }
        return thoughts;
    }

    CodeStrategy parseStrategy(String response) {
        String strategyId = "strategy-" + UUID.randomUUID().toString().substring(0, 8);
        JsonNode node = null;
        try {
            node = parser.extractJson(response);
        } catch (Exception e) {
            log.debug("Strategy response is not JSON: {}", e.getMessage());
        }

        JsonNode changes = node == null ? null
                : node.has("file_changes") ? node.get("file_changes") : node.get("fileChanges");
        if (changes != null && changes.isObject()) {
            Map<String, String> fileChanges = new LinkedHashMap<>();
            changes.fields().forEachRemaining(entry -> fileChanges.put(entry.getKey(), entry.getValue().asText()));
            return CodeStrategy.builder()
                    .strategyId(strategyId)
                    .title(node.has("title") ? node.get("title").asText() : "")
                    .description(node.has("description") ? node.get("description").asText() : "")
                    .fileChanges(fileChanges)
                    .build();
        }

        Optional<Map.Entry<String, String>> fenced = parser.extractCodeFromFence(response);
        if (fenced.isPresent()) {
            log.warn("Strategy response had no file_changes, using the first code block as solution file");
            String lang = fenced.get().getKey();
            return CodeStrategy.builder()
                    .strategyId(strategyId)
                    .title("Unstructured strategy")
                    .description("Recovered from a code block in the model reply")
                    .fileChanges(Map.of("solution." + extensionFor(lang), fenced.get().getValue()))
                    .build();
        }
        throw new LatsExecutionException("Strategy response contained neither file changes nor code: "
                + ModelResponseParser.abbreviate(response, 200));
    }

    private static String extensionFor(String lang) {
        return switch (lang == null ? "" : lang) {
            case "java" -> "java";
            case "javascript", "js" -> "js";
            case "typescript", "ts" -> "ts";
            case "bash", "sh" -> "sh";
            default -> "py";
        };
    }
}
