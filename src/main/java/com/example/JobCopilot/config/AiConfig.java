package com.example.JobCopilot.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.deepseek.DeepSeekChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Chat clients keyed by provider. Bean names follow "{provider}ChatClient" so that
 * {@code copilot.model.provider} can pick one at request time.
 * <p>
 * System prompts are versioned per request, so no default system text is set here.
 */
@Configuration
public class AiConfig {

    /**
     * OpenAI is the default provider for the copilot.
     * Only created when an OpenAiChatModel bean exists, so a missing key in some envs
     * does not stop the app from starting.
     */
    @Bean
    @Primary
    @ConditionalOnBean(OpenAiChatModel.class)
    public ChatClient openaiChatClient(OpenAiChatModel model) {
        return ChatClient.builder(model).build();
    }

    @Bean
    @ConditionalOnBean(DeepSeekChatModel.class)
    public ChatClient deepseekChatClient(DeepSeekChatModel model) {
        return ChatClient.builder(model).build();
    }

    /**
     * Fallback when neither conditional bean matched during startup ordering:
     * prefer OpenAI, then DeepSeek.
     */
    @Bean
    @ConditionalOnMissingBean(ChatClient.class)
    public ChatClient defaultChatClient(
            ObjectProvider<OpenAiChatModel> openAiProvider,
            ObjectProvider<DeepSeekChatModel> deepSeekProvider
    ) {
        OpenAiChatModel openAiModel = openAiProvider.getIfAvailable();
        if (openAiModel != null) {
            return ChatClient.builder(openAiModel).build();
        }

        DeepSeekChatModel deepSeekModel = deepSeekProvider.getIfAvailable();
        if (deepSeekModel != null) {
            return ChatClient.builder(deepSeekModel).build();
        }

        throw new IllegalStateException("No ChatModel beans are available to build a ChatClient");
    }
}
