package com.example.JobCopilot.service;

import com.example.JobCopilot.model.CopilotMessage;
import com.example.JobCopilot.repository.CopilotMessageRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Writes every chat turn to {@code copilot_messages}. Audit failures are logged and never
 * fail the answer.
 */
@Service
@RequiredArgsConstructor
public class CopilotAuditService {

    private static final Logger log = LoggerFactory.getLogger(CopilotAuditService.class);

    private final CopilotMessageRepository copilotMessageRepository;
    private final ObjectMapper objectMapper;

    public record Turn(
            String tenantId,
            String jobId,
            String userId,
            String conversationId,
            String model,
            String promptVersion,
            String question,
            String answer,
            Map<String, Object> answerMetadata
    ) { }

    public void recordTurn(Turn turn) {
        try {
            CopilotMessage user = message(turn, "user", turn.question(), null);
            CopilotMessage assistant = message(turn, "assistant", turn.answer(), serialize(turn.answerMetadata()));
            copilotMessageRepository.saveAll(List.of(user, assistant));
        } catch (DataAccessException e) {
            log.warn("Failed to write chat audit for job {} in tenant {}: {}",
                    turn.jobId(), turn.tenantId(), e.getMessage());
        }
    }

    static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private CopilotMessage message(Turn turn, String role, String content, String metadataJson) {
        String text = content == null ? "" : content;
        CopilotMessage message = new CopilotMessage();
        message.setConversationId(turn.conversationId());
        message.setTenantId(turn.tenantId());
        message.setJobId(turn.jobId());
        message.setUserId(turn.userId());
        message.setRole(role);
        message.setContent(text);
        message.setModel(turn.model());
        message.setPromptVersion(turn.promptVersion());
        message.setMetadataJson(metadataJson);
        message.setContentHash(sha256(text));
        return message;
    }

    private String serialize(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize chat audit metadata", e);
            return null;
        }
    }
}
