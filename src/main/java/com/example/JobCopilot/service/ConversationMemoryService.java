package com.example.JobCopilot.service;

import com.example.JobCopilot.model.ConversationHistory;
import com.example.JobCopilot.model.PromptMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Rolling per-session chat history in Redis, one list per tenant, job and session.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationMemoryService {

    private static final String KEY_PREFIX = "copilot:memory:";

    /** Max number of messages (user + assistant) kept per session. */
    static final int MAX_MESSAGES_PER_SESSION = 50;

    /**
     * Sessions live as long as they had a turn in the last 7 days;
     * every new turn refreshes the TTL.
     */
    private static final Duration SESSION_TTL = Duration.ofDays(7);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    /**
     * Latest {@code limit} messages, oldest first. Malformed entries are skipped.
     */
    public List<StoredMessage> loadHistory(String tenantId, String jobId, String sessionId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        String key = buildKey(tenantId, jobId, sessionId);
        Long size = redisTemplate.opsForList().size(key);
        if (size == null || size == 0L) {
            return List.of();
        }

        long start = Math.max(0, size - limit);
        List<String> rawMessages = redisTemplate.opsForList().range(key, start, size - 1);
        if (rawMessages == null || rawMessages.isEmpty()) {
            return List.of();
        }

        List<StoredMessage> messages = new ArrayList<>();
        for (String raw : rawMessages) {
            try {
                messages.add(objectMapper.readValue(raw, StoredMessage.class));
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed history entry in {}: {}", key, e.getOriginalMessage());
            }
        }
        return messages;
    }

    /**
     * Append one full turn (user + assistant), trim the list to the window and refresh the TTL.
     */
    public void appendTurn(String tenantId, String jobId, String sessionId, String userMessage, String assistantMessage) {
        String key = buildKey(tenantId, jobId, sessionId);
        long now = Instant.now().toEpochMilli();
        List<StoredMessage> turn = List.of(
                new StoredMessage(PromptMessage.USER, userMessage, now),
                new StoredMessage(PromptMessage.ASSISTANT, assistantMessage, now));

        for (StoredMessage message : turn) {
            try {
                redisTemplate.opsForList().rightPush(key, objectMapper.writeValueAsString(message));
            } catch (JsonProcessingException e) {
                log.warn("Dropping unserializable {} message for {}", message.role(), key);
            }
        }

        // Keep only the newest MAX_MESSAGES_PER_SESSION messages
        redisTemplate.opsForList().trim(key, -MAX_MESSAGES_PER_SESSION, -1);
        redisTemplate.expire(key, SESSION_TTL);
    }

    /**
     * Whole stored window of a session for display. Redis being down reads as an empty history.
     */
    public ConversationHistory getConversation(String tenantId, String jobId, String sessionId) {
        List<StoredMessage> stored;
        try {
            stored = loadHistory(tenantId, jobId, sessionId, MAX_MESSAGES_PER_SESSION);
        } catch (DataAccessException e) {
            log.warn("Conversation history unavailable for session {}: {}", sessionId, e.getMessage());
            stored = List.of();
        }
        return new ConversationHistory(sessionId, stored.stream()
                .map(m -> new ConversationHistory.Message(m.role(), m.content(), Instant.ofEpochMilli(m.timestamp())))
                .toList());
    }

    public static List<PromptMessage> toPromptMessages(List<StoredMessage> messages) {
        return messages.stream()
                .filter(m -> PromptMessage.USER.equals(m.role()) || PromptMessage.ASSISTANT.equals(m.role()))
                .map(m -> new PromptMessage(m.role(), m.content()))
                .toList();
    }

    // A session id reused on another job must not see this job's turns
    static String buildKey(String tenantId, String jobId, String sessionId) {
        return KEY_PREFIX + tenantId + ":" + jobId + ":" + sessionId;
    }

    public record StoredMessage(String role, String content, long timestamp) { }
}
