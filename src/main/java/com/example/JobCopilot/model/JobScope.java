package com.example.JobCopilot.model;

/**
 * The entities a job hangs off. Notes attached to any of them count as evidence for the job.
 */
public record JobScope(String jobId, String clientId, String propertyId) {
}
