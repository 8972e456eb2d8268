package com.example.JobCopilot.model;

public record PropertyIngestRequest(
        String id,
        String clientId,
        String addressLine1,
        String addressLine2,
        String city,
        String state,
        String zip,
        String accessNotes
) {
}
