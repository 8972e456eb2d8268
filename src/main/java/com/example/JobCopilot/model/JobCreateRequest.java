package com.example.JobCopilot.model;

public record JobCreateRequest(
        String clientId,
        String propertyId,
        String jobType,
        String scheduledAt,
        String status,
        String summary
) {
}
