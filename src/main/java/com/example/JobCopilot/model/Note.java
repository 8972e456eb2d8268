package com.example.JobCopilot.model;

import java.time.Instant;

/**
 * A stored note plus the author's display name when the author is a known user.
 */
public record Note(
        String id,
        String entityType,
        String entityId,
        String noteType,
        String content,
        String authorUserId,
        String authorName,
        Instant createdAt
) {
}
