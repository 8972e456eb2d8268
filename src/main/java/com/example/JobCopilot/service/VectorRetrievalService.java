package com.example.JobCopilot.service;

import com.example.JobCopilot.config.CopilotProperties;
import com.example.JobCopilot.model.EvidenceItem;
import com.example.JobCopilot.model.VectorDiagnostics;
import com.example.JobCopilot.model.VectorDiagnostics.FilterError;
import com.example.JobCopilot.model.VectorMatch;
import com.example.JobCopilot.model.VectorQuery;
import com.example.JobCopilot.model.VectorRecord;
import com.example.JobCopilot.model.VectorRetrievalResult;
import com.example.JobCopilot.repository.VectorIndex;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Vector evidence for a job question:
 * - Embeds the question
 * - Queries the vector index with progressively looser metadata filters
 * - Falls back to an unfiltered query with local tenant/job filtering
 * - Converts surviving matches into evidence items
 *
 * Every failure (embedding, backend, malformed metadata) degrades to empty evidence;
 * the chat answer is still produced from lexical evidence.
 */
@Service
@RequiredArgsConstructor
public class VectorRetrievalService {

    private static final Logger log = LoggerFactory.getLogger(VectorRetrievalService.class);

    static final String TENANT_KEY = "tenant_id";
    static final String JOB_KEY = "job_id";

    private final EmbeddingModel embeddingModel;
    private final VectorIndex vectorIndex;
    private final CopilotProperties properties;

    /**
     * Retrieval flow:
     * 1. Skip entirely when the index is not configured
     * 2. Embed the question
     * 3. Try filters {tenant, job}, {tenant}, {job}; keep the first producing matches that
     *    really belong to the caller's tenant and job
     * 4. Otherwise query unfiltered with a wider topK and filter locally
     * 5. In debug mode, also return raw unfiltered matches and their stored metadata
     *
     * @param tenantId caller tenant; matches from other tenants are always dropped
     * @param jobId    job the question is about
     * @param query    the technician's question
     * @param debug    include raw matches in the diagnostics
     */
    public VectorRetrievalResult retrieve(String tenantId, String jobId, String query, boolean debug) {
        // 1. Index not configured
        if (!properties.getVector().isEnabled()) {
            return VectorRetrievalResult.disabled();
        }
        CopilotProperties.Retrieval retrieval = properties.getRetrieval();

        Map<String, Object> requestedFilter = filter(tenantId, jobId);
        List<FilterError> filterErrors = new ArrayList<>();

        // 2. Embed the question
        float[] embedding;
        try {
            embedding = embeddingModel.embed(query);
        } catch (RuntimeException e) {
            log.warn("Vector retrieval skipped, embedding failed: {}", e.getMessage());
            return empty(requestedFilter, filterErrors);
        }
        if (embedding == null || embedding.length == 0) {
            log.warn("Vector retrieval skipped, embedding was empty");
            return empty(requestedFilter, filterErrors);
        }

        // 3. Scoped queries, most specific filter first
        List<VectorMatch> accepted = List.of();
        Map<String, Object> filterUsed = null;
        for (Map<String, Object> candidate : filterCandidates(tenantId, jobId)) {
            try {
                List<VectorMatch> matches = belongingTo(
                        vectorIndex.query(embedding, new VectorQuery(retrieval.getTopK(), candidate)), tenantId, jobId);
                if (!matches.isEmpty()) {
                    accepted = matches;
                    filterUsed = candidate;
                    break;
                }
            } catch (RuntimeException e) {
                log.debug("Vector filter {} failed: {}", candidate.keySet(), e.getMessage());
                filterErrors.add(new FilterError(candidate, e.getMessage()));
            }
        }

        // 4. Unfiltered fallback with local filtering
        boolean fallbackUsed = false;
        if (accepted.isEmpty()) {
            try {
                accepted = belongingTo(
                        vectorIndex.query(embedding, VectorQuery.unfiltered(retrieval.getFallbackTopK())), tenantId, jobId);
                fallbackUsed = !accepted.isEmpty();
                if (fallbackUsed) {
                    log.warn("Vector filters returned nothing for job {}; unfiltered fallback kept {} matches",
                            jobId, accepted.size());
                }
            } catch (RuntimeException e) {
                log.warn("Unfiltered vector query failed: {}", e.getMessage());
                accepted = List.of();
            }
        }

        // 5. Raw matches for diagnostics
        List<VectorMatch> unfiltered = List.of();
        List<VectorRecord> metadata = List.of();
        if (debug) {
            try {
                unfiltered = vectorIndex.query(embedding, VectorQuery.unfiltered(retrieval.getDebugTopK()));
                metadata = vectorIndex.get(unfiltered.stream().map(VectorMatch::id).toList());
            } catch (RuntimeException e) {
                log.debug("Debug vector lookup failed: {}", e.getMessage());
            }
        }

        log.debug("Vector retrieval for job {}: {} matches (filter={}, fallback={})",
                jobId, accepted.size(), filterUsed == null ? null : filterUsed.keySet(), fallbackUsed);

        VectorDiagnostics diagnostics = new VectorDiagnostics(
                true,
                accepted.size(),
                requestedFilter,
                filterUsed,
                filterErrors,
                fallbackUsed,
                unfiltered,
                metadata);
        return new VectorRetrievalResult(toEvidence(accepted), diagnostics);
    }

    /**
     * Convert matches into evidence items. The snippet comes from the stored text,
     * the doc id from {@code doc_id} (falling back to the vector id).
     */
    static List<EvidenceItem> toEvidence(List<VectorMatch> matches) {
        return matches.stream()
                .map(match -> {
                    Map<String, Object> meta = match.metadata() == null ? Map.of() : match.metadata();
                    String docId = stringValue(meta.get("doc_id"));
                    String type = stringValue(meta.get("type"));
                    String snippet = stringValue(meta.get("snippet"));
                    if (snippet == null) {
                        snippet = stringValue(meta.get("text"));
                    }
                    return new EvidenceItem(
                            docId != null ? docId : match.id(),
                            type != null ? type : "vector",
                            EvidenceItem.SCOPE_VECTOR,
                            parseDate(stringValue(meta.get("created_at"))),
                            snippet != null ? snippet : "",
                            null,
                            match.score());
                })
                .toList();
    }

    private static List<Map<String, Object>> filterCandidates(String tenantId, String jobId) {
        return List.of(
                filter(tenantId, jobId),
                Map.of(TENANT_KEY, tenantId),
                Map.of(JOB_KEY, jobId));
    }

    private static Map<String, Object> filter(String tenantId, String jobId) {
        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put(TENANT_KEY, tenantId);
        filter.put(JOB_KEY, jobId);
        return filter;
    }

    private static List<VectorMatch> belongingTo(List<VectorMatch> matches, String tenantId, String jobId) {
        if (matches == null) {
            return List.of();
        }
        return matches.stream()
                .filter(match -> match.metadata() != null
                        && tenantId.equals(stringValue(match.metadata().get(TENANT_KEY)))
                        && jobId.equals(stringValue(match.metadata().get(JOB_KEY))))
                .toList();
    }

    private static VectorRetrievalResult empty(Map<String, Object> requestedFilter, List<FilterError> filterErrors) {
        return new VectorRetrievalResult(List.of(), new VectorDiagnostics(
                true, 0, requestedFilter, null, filterErrors, false, List.of(), List.of()));
    }

    private static String stringValue(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static Instant parseDate(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
