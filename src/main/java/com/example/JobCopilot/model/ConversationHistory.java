package com.example.JobCopilot.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/** Stored turns of one copilot session, oldest first. */
public record ConversationHistory(
        @JsonProperty("session_id") String sessionId,
        List<Message> messages
) {

    public record Message(
            String role,
            String content,
            @JsonProperty("created_at") Instant createdAt
    ) {
    }
}
