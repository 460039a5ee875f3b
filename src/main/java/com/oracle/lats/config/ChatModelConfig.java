package com.oracle.lats.config;

import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.google.genai.GoogleGenAiChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Scope;

@Configuration
public class ChatModelConfig {

    /**
     * ChatClient.Builder backed by the first configured provider:
     * OpenAI, then Anthropic, then Google. Startup fails when none is configured.
     * Prototype scoped: the executor and the judge customize their own builders.
     */
    @Bean
    @Primary
    @Scope("prototype")
    public ChatClient.Builder chatClientBuilder(
            ObjectProvider<OpenAiChatModel> openAiProvider,
            ObjectProvider<AnthropicChatModel> anthropicProvider,
            ObjectProvider<GoogleGenAiChatModel> googleProvider) {

        ChatModel model = openAiProvider.getIfAvailable();
        if (model == null) {
            model = anthropicProvider.getIfAvailable();
        }
        if (model == null) {
            model = googleProvider.getIfAvailable();
        }

        if (model == null) {
            throw new IllegalStateException(
                "No ChatModel bean available. Configure at least one provider "
                + "(e.g. set spring.ai.openai.api-key/OPENAI_API_KEY or the matching Anthropic/Google settings).");
        }

        return ChatClient.builder(model);
    }
}
