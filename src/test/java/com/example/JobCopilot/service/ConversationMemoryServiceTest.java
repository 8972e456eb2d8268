package com.example.JobCopilot.service;

import com.example.JobCopilot.model.ConversationHistory;
import com.example.JobCopilot.model.PromptMessage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConversationMemoryServiceTest {

    private static final String KEY = "copilot:memory:tenant_a:job_1:session_job_1";

    private StringRedisTemplate redisTemplate;
    private ListOperations<String, String> listOps;
    private ConversationMemoryService service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        listOps = mock(ListOperations.class);
        when(redisTemplate.opsForList()).thenReturn(listOps);
        service = new ConversationMemoryService(redisTemplate, new ObjectMapper());
    }

    @Test
    void loadsNewestWindowAndSkipsMalformedEntries() {
        when(listOps.size(KEY)).thenReturn(5L);
        when(listOps.range(KEY, 2L, 4L)).thenReturn(List.of(
                "{\"role\":\"user\",\"content\":\"Any warranty?\",\"timestamp\":1}",
                "not json",
                "{\"role\":\"assistant\",\"content\":\"Not in the history.\",\"timestamp\":2}"));

        List<ConversationMemoryService.StoredMessage> history = service.loadHistory("tenant_a", "job_1", "session_job_1", 3);

        assertThat(history).extracting(ConversationMemoryService.StoredMessage::content)
                .containsExactly("Any warranty?", "Not in the history.");
    }

    @Test
    void emptyOrDisabledHistoryIsEmpty() {
        when(listOps.size(KEY)).thenReturn(0L);

        assertThat(service.loadHistory("tenant_a", "job_1", "session_job_1", 10)).isEmpty();
        assertThat(service.loadHistory("tenant_a", "job_1", "session_job_1", 0)).isEmpty();
        verify(listOps, never()).range(anyString(), anyLong(), anyLong());
    }

    @Test
    void appendPushesBothMessagesThenTrimsAndRefreshesTtl() {
        service.appendTurn("tenant_a", "job_1", "session_job_1", "Any warranty?", "Not in the history.");

        verify(listOps, times(2)).rightPush(eq(KEY), anyString());
        verify(listOps).trim(KEY, -ConversationMemoryService.MAX_MESSAGES_PER_SESSION, -1);
        verify(redisTemplate).expire(KEY, Duration.ofDays(7));
    }

    @Test
    void sameSessionIdOnAnotherJobUsesASeparateList() {
        String otherJobKey = "copilot:memory:tenant_a:job_2:session_shared";
        when(listOps.size(otherJobKey)).thenReturn(0L);

        service.appendTurn("tenant_a", "job_1", "session_shared", "Any warranty?", "No.");

        assertThat(service.loadHistory("tenant_a", "job_2", "session_shared", 10)).isEmpty();
        verify(listOps, times(2)).rightPush(eq("copilot:memory:tenant_a:job_1:session_shared"), anyString());
        verify(listOps, never()).rightPush(eq(otherJobKey), anyString());
        verify(listOps, never()).range(eq(otherJobKey), anyLong(), anyLong());
    }

    @Test
    void conversationListsStoredTurnsWithTimestamps() {
        when(listOps.size(KEY)).thenReturn(2L);
        when(listOps.range(KEY, 0L, 1L)).thenReturn(List.of(
                "{\"role\":\"user\",\"content\":\"Any warranty?\",\"timestamp\":1717236000000}",
                "{\"role\":\"assistant\",\"content\":\"Not on record.\",\"timestamp\":1717236001000}"));

        ConversationHistory conversation = service.getConversation("tenant_a", "job_1", "session_job_1");

        assertThat(conversation.sessionId()).isEqualTo("session_job_1");
        assertThat(conversation.messages()).extracting(ConversationHistory.Message::role)
                .containsExactly("user", "assistant");
        assertThat(conversation.messages().get(0).createdAt()).isEqualTo(Instant.parse("2024-06-01T10:00:00Z"));
    }

    @Test
    void conversationIsEmptyWhenRedisIsDown() {
        when(listOps.size(KEY)).thenThrow(new RedisConnectionFailureException("down"));

        assertThat(service.getConversation("tenant_a", "job_1", "session_job_1").messages()).isEmpty();
    }

    @Test
    void onlyUserAndAssistantTurnsReachThePrompt() {
        List<PromptMessage> messages = ConversationMemoryService.toPromptMessages(List.of(
                new ConversationMemoryService.StoredMessage("system", "ignored", 1L),
                new ConversationMemoryService.StoredMessage("user", "Hi", 2L)));

        assertThat(messages).containsExactly(PromptMessage.user("Hi"));
    }
}
