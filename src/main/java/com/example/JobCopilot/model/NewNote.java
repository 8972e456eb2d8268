package com.example.JobCopilot.model;

public record NewNote(
        String tenantId,
        String id,
        String entityType,
        String entityId,
        String noteType,
        String content,
        String authorUserId,
        String idempotencyKey
) {
}
