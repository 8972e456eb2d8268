package com.example.JobCopilot.model;

public record NoteIngestRequest(
        String id,
        String entityType,
        String entityId,
        String noteType,
        String content,
        String jobId
) {
}
