package com.oracle.lats.core.impl;

import com.oracle.lats.config.LatsConfig;
import com.oracle.lats.core.LatsExecutionException;
import com.oracle.lats.core.ThoughtJudge;
import com.oracle.lats.service.LatsPromptService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

/**
 * Asks the verifier model (or the generator when cross-model review is off) to rate a thought.
 * Identical thoughts are judged once per cache lifetime.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChatThoughtJudge implements ThoughtJudge {

    private final ChatClient.Builder chatClientBuilder;
    private volatile ChatClient chatClient;
    private final LatsPromptService promptService;
    private final LatsConfig latsConfig;
    private final ModelResponseParser parser = new ModelResponseParser();

    @Override
    @Cacheable("thoughtJudgements")
    public double judge(String thought) {
        if (this.chatClient == null) {
            synchronized (this) {
                if (this.chatClient == null) {
                    this.chatClient = chatClientBuilder.build();
                }
            }
        }
        String model = latsConfig.isEnableCrossModel()
                ? latsConfig.getVerifierModel()
                : latsConfig.getGeneratorModel();

        String response;
        try {
            response = chatClient.prompt()
                    .user(promptService.createJudgePrompt(thought))
                    .options(ChatOptions.builder()
                            .model(model)
                            .temperature(latsConfig.getTemperatureEvaluation())
                            .build())
                    .call()
                    .content();
        } catch (Exception e) {
            throw new LatsExecutionException("Judge call failed: " + e.getMessage(), e);
        }

        return parser.extractScore(response).orElseGet(() -> {
            log.warn("Judge reply had no score: {}", ModelResponseParser.abbreviate(response, 200));
            return Double.NaN;
        });
    }
}
