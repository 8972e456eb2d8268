package com.example.JobCopilot.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Map;

/**
 * A stored vector. {@code values} is only populated on writes.
 */
public record VectorRecord(String id, @JsonIgnore float[] values, Map<String, Object> metadata) {

    public static VectorRecord metadataOnly(String id, Map<String, Object> metadata) {
        return new VectorRecord(id, null, metadata);
    }
}
