package com.example.JobCopilot.model;

import java.time.Instant;

public record Job(
        String id,
        String clientId,
        String propertyId,
        String jobType,
        String status,
        Instant scheduledAt,
        String assignedUserId,
        String summary,
        Instant createdAt,
        Instant updatedAt
) {
}
