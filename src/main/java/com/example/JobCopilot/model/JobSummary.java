package com.example.JobCopilot.model;

import java.time.Instant;

/** Job row as listed by the job routes, with the assignee's display name. */
public record JobSummary(
        String id,
        String clientId,
        String propertyId,
        String jobType,
        String status,
        Instant scheduledAt,
        String summary,
        String assignedUserId,
        String assignedUserName,
        Instant createdAt,
        Instant updatedAt
) {
}
