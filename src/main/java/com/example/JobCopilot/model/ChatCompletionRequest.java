package com.example.JobCopilot.model;

import java.util.List;

public record ChatCompletionRequest(
        String model,
        double temperature,
        double topP,
        int maxTokens,
        boolean jsonMode,
        List<PromptMessage> messages
) {
}
