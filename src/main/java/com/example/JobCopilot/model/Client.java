package com.example.JobCopilot.model;

import java.time.Instant;
import java.util.List;

public record Client(
        String id,
        String name,
        String type,
        String primaryPhone,
        String email,
        List<String> tags,
        Instant createdAt,
        Instant updatedAt
) {
}
