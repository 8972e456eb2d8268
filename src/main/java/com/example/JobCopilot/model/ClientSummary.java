package com.example.JobCopilot.model;

import java.time.Instant;

/**
 * Client row for listings, with the address of its oldest property.
 */
public record ClientSummary(
        String id,
        String name,
        String type,
        String primaryPhone,
        String email,
        String addressLine1,
        String city,
        String state,
        String zip,
        Instant createdAt,
        Instant updatedAt
) {
}
