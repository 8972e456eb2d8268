package com.example.JobCopilot.model;

import java.time.Instant;

public record Property(
        String id,
        String clientId,
        String addressLine1,
        String addressLine2,
        String city,
        String state,
        String zip,
        String accessNotes,
        Instant createdAt
) {
}
