package com.example.JobCopilot.model;

import java.time.Instant;
import java.util.List;

/**
 * Structured view of a job handed to the model and returned by the context route.
 */
public record JobContextSnapshot(
        JobDetails job,
        Client client,
        Property property,
        List<Equipment> equipment,
        List<JobEvent> recentEvents,
        Instant generatedAt
) {

    public record JobDetails(
            String id,
            String jobType,
            String status,
            Instant scheduledAt,
            String summary,
            AssignedUser assignedTo,
            Instant createdAt,
            Instant updatedAt
    ) {
    }

    public record AssignedUser(String id, String name, String email, String role) {
    }
}
