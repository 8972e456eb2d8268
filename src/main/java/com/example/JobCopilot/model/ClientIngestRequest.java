package com.example.JobCopilot.model;

import java.util.List;

public record ClientIngestRequest(
        String id,
        String name,
        String type,
        String primaryPhone,
        String email,
        List<String> tags
) {
}
