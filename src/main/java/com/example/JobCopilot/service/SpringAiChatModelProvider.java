package com.example.JobCopilot.service;

import com.example.JobCopilot.config.CopilotProperties;
import com.example.JobCopilot.exception.UpstreamException;
import com.example.JobCopilot.model.ChatCompletionRequest;
import com.example.JobCopilot.model.PromptMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.ResponseFormat;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ChatModelProvider} over the Spring AI {@link ChatClient} beans.
 * The client is picked by {@code copilot.model.provider}, matching bean names "{provider}ChatClient".
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SpringAiChatModelProvider implements ChatModelProvider {

    static final String DEFAULT_PROVIDER = "openai";

    private final Map<String, ChatClient> chatClients;
    private final CopilotProperties properties;

    @Override
    public String complete(ChatCompletionRequest request) {
        String provider = Optional.ofNullable(properties.getModel().getProvider())
                .map(p -> p.toLowerCase(Locale.ROOT))
                .orElse(DEFAULT_PROVIDER);
        ChatClient chatClient = resolveClient(provider);

        List<Message> messages = request.messages().stream()
                .map(SpringAiChatModelProvider::toMessage)
                .toList();
        Prompt prompt = new Prompt(messages, options(provider, request));

        try {
            String content = chatClient.prompt(prompt).call().content();
            return content == null ? "" : content;
        } catch (RuntimeException e) {
            log.error("Chat completion via {} failed: {}", provider, e.getMessage());
            throw new UpstreamException("Model provider request failed", e);
        }
    }

    private ChatClient resolveClient(String provider) {
        ChatClient client = chatClients.get(provider + "ChatClient");
        if (client != null) {
            return client;
        }
        ChatClient fallback = chatClients.get(DEFAULT_PROVIDER + "ChatClient");
        if (fallback != null) {
            return fallback;
        }
        return chatClients.values().stream().findFirst()
                .orElseThrow(() -> new IllegalStateException("No ChatClient beans are available"));
    }

    private static ChatOptions options(String provider, ChatCompletionRequest request) {
        if (DEFAULT_PROVIDER.equals(provider)) {
            OpenAiChatOptions.Builder builder = OpenAiChatOptions.builder()
                    .model(request.model())
                    .temperature(request.temperature())
                    .topP(request.topP())
                    .maxTokens(request.maxTokens());
            if (request.jsonMode()) {
                builder.responseFormat(ResponseFormat.builder().type(ResponseFormat.Type.JSON_OBJECT).build());
            }
            return builder.build();
        }
        return ChatOptions.builder()
                .model(request.model())
                .temperature(request.temperature())
                .topP(request.topP())
                .maxTokens(request.maxTokens())
                .build();
    }

    private static Message toMessage(PromptMessage message) {
        if (PromptMessage.SYSTEM.equals(message.role())) {
            return new SystemMessage(message.content());
        }
        if (PromptMessage.ASSISTANT.equals(message.role())) {
            return new AssistantMessage(message.content());
        }
        return new UserMessage(message.content());
    }
}
