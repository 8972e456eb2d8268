package com.example.JobCopilot.model;

import java.util.Map;

/** An empty filter means an unfiltered query. */
public record VectorQuery(int topK, Map<String, Object> filter) {

    public static VectorQuery unfiltered(int topK) {
        return new VectorQuery(topK, Map.of());
    }

    public boolean hasFilter() {
        return filter != null && !filter.isEmpty();
    }
}
