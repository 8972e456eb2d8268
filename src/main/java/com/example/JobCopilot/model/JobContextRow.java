package com.example.JobCopilot.model;

/**
 * One row of the job, client, property and assignee join behind the context snapshot.
 */
public record JobContextRow(
        JobContextSnapshot.JobDetails job,
        Client client,
        Property property
) {
}
