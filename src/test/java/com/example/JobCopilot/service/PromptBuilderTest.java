package com.example.JobCopilot.service;

import com.example.JobCopilot.model.PromptMessage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PromptBuilderTest {

    private final PromptBuilder builder = new PromptBuilder();

    @Test
    void ordersSystemContextHistoryAndQuestion() {
        List<PromptMessage> history = List.of(
                PromptMessage.user("What is the gate code?"),
                PromptMessage.assistant("{\"answer\":\"1234\"}"));

        List<PromptMessage> messages = builder.build("copilot.v1", "{\"job\":{}}", "Job Notes:\n- x", history,
                "Any prior repairs?");

        assertThat(messages).extracting(PromptMessage::role)
                .containsExactly(PromptMessage.SYSTEM, PromptMessage.SYSTEM, PromptMessage.USER,
                        PromptMessage.ASSISTANT, PromptMessage.USER);
        assertThat(messages.get(0).content()).isEqualTo(PromptTemplates.systemPrompt("copilot.v1"));
        assertThat(messages.get(1).content())
                .startsWith("Structured context:\n{\"job\":{}}")
                .endsWith("Evidence (labeled sections):\nJob Notes:\n- x");
        assertThat(messages.get(4).content()).isEqualTo("Any prior repairs?");
    }

    @Test
    void unknownVersionFallsBackToDefaultTemplate() {
        assertThat(PromptTemplates.resolveVersion("copilot.v99")).isEqualTo(PromptTemplates.DEFAULT_VERSION);
        assertThat(PromptTemplates.systemPrompt("copilot.v99"))
                .isEqualTo(PromptTemplates.systemPrompt(PromptTemplates.DEFAULT_VERSION));
    }
}
