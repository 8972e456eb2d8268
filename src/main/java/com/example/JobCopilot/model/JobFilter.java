package com.example.JobCopilot.model;

import java.time.Instant;

/**
 * Optional job list filters; null fields are not applied. The schedule window applies only
 * when both ends are set.
 */
public record JobFilter(
        String clientId,
        String status,
        String jobType,
        String assignedUserId,
        Instant scheduledFrom,
        Instant scheduledTo
) {
}
