package com.example.JobCopilot.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record IngestResult(String id, Boolean idempotent) {

    public static IngestResult created(String id) {
        return new IngestResult(id, null);
    }

    public static IngestResult replayed(String id) {
        return new IngestResult(id, Boolean.TRUE);
    }

    @JsonIgnore
    public boolean isReplay() {
        return Boolean.TRUE.equals(idempotent);
    }
}
