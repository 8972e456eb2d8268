package com.example.JobCopilot.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * One citable piece of evidence. {@code type} is "note" or "job_event" for stored rows and the
 * stored type for vector matches; {@code scope} is "job", "client", "property" or "vector".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EvidenceItem(
        String docId,
        String type,
        String scope,
        Instant date,
        String snippet,
        String author,
        Double score
) {

    public static final String TYPE_NOTE = "note";
    public static final String TYPE_JOB_EVENT = "job_event";
    public static final String SCOPE_VECTOR = "vector";

    public static EvidenceItem stored(String docId, String type, String scope, Instant date, String snippet, String author) {
        return new EvidenceItem(docId, type, scope, date, snippet, author, null);
    }
}
