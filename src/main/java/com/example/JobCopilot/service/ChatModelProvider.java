package com.example.JobCopilot.service;

import com.example.JobCopilot.model.ChatCompletionRequest;

/**
 * Chat completion backend. Returns the raw assistant text; parsing is the caller's job.
 */
public interface ChatModelProvider {

    /**
     * @throws com.example.JobCopilot.exception.UpstreamException when the provider call fails
     */
    String complete(ChatCompletionRequest request);
}
