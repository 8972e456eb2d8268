package com.example.JobCopilot.model;

/** {@code scheduledAt} is an ISO-8601 instant, e.g. 2025-02-10T14:00:00Z. */
public record JobIngestRequest(
        String id,
        String clientId,
        String propertyId,
        String jobType,
        String status,
        String scheduledAt,
        String assignedUserId,
        String summary
) {
}
