package com.example.JobCopilot.model;

/**
 * Body of the chat route. {@code sessionId} is optional and defaults to the job's session.
 */
public record ChatRequest(String message, String sessionId) {
}
