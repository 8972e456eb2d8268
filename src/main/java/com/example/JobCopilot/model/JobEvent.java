package com.example.JobCopilot.model;

import java.time.Instant;

public record JobEvent(
        String id,
        String jobId,
        String propertyId,
        String clientId,
        String equipmentId,
        String eventType,
        String issue,
        String resolution,
        String partsUsedJson,
        Instant createdAt
) {
}
