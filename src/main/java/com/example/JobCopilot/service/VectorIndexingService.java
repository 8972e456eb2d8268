package com.example.JobCopilot.service;

import com.example.JobCopilot.config.CopilotProperties;
import com.example.JobCopilot.exception.JobNotFoundException;
import com.example.JobCopilot.model.JobEvent;
import com.example.JobCopilot.model.JobScope;
import com.example.JobCopilot.model.Note;
import com.example.JobCopilot.model.VectorRecord;
import com.example.JobCopilot.repository.JobEventRepository;
import com.example.JobCopilot.repository.JobRepository;
import com.example.JobCopilot.repository.NoteRepository;
import com.example.JobCopilot.repository.VectorIndex;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Embeds a job's recent notes and events into the vector index.
 * Vector ids are "{tenant}:job_event_{id}" / "{tenant}:note_{id}" so re-running replaces rows.
 */
@Service
@RequiredArgsConstructor
public class VectorIndexingService {

    private static final Logger log = LoggerFactory.getLogger(VectorIndexingService.class);

    private final JobRepository jobRepository;
    private final JobEventRepository jobEventRepository;
    private final NoteRepository noteRepository;
    private final EmbeddingModel embeddingModel;
    private final VectorIndex vectorIndex;
    private final CopilotProperties properties;

    /**
     * @return number of records written
     * @throws JobNotFoundException when the job does not exist in the tenant
     */
    public int reindexJobEvidence(String tenantId, String jobId) {
        JobScope scope = jobRepository.findScope(tenantId, jobId)
                .orElseThrow(() -> new JobNotFoundException(tenantId, jobId));
        int limit = properties.getVector().getReindexLimit();

        List<String> ids = new ArrayList<>();
        List<String> texts = new ArrayList<>();
        List<Map<String, Object>> metadata = new ArrayList<>();

        for (JobEvent event : jobEventRepository.findRecentByJob(tenantId, jobId, limit)) {
            String text = JobEvidenceService.eventSnippet(event);
            if (text.isBlank()) {
                continue;
            }
            String docId = "job_event_" + event.id();
            ids.add(tenantId + ":" + docId);
            texts.add(text);
            metadata.add(metadata(tenantId, scope, "job_event", docId, event.createdAt(), text));
        }

        for (Note note : noteRepository.findRecentForScope(tenantId, scope, limit)) {
            String text = note.content();
            if (text == null || text.isBlank()) {
                continue;
            }
            String docId = "note_" + note.id();
            ids.add(tenantId + ":" + docId);
            texts.add(text);
            metadata.add(metadata(tenantId, scope, "note", docId, note.createdAt(), text));
        }

        if (texts.isEmpty()) {
            log.info("No evidence to embed for job {} in tenant {}", jobId, tenantId);
            return 0;
        }

        List<float[]> embeddings = embeddingModel.embed(texts);
        List<VectorRecord> records = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            records.add(new VectorRecord(ids.get(i), embeddings.get(i), metadata.get(i)));
        }
        vectorIndex.upsert(records);

        log.info("Indexed {} evidence vectors for job {} in tenant {}", records.size(), jobId, tenantId);
        return records.size();
    }

    private static Map<String, Object> metadata(String tenantId, JobScope scope, String type, String docId,
                                                Instant createdAt, String text) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(VectorRetrievalService.TENANT_KEY, tenantId);
        metadata.put(VectorRetrievalService.JOB_KEY, scope.jobId());
        metadata.put("property_id", scope.propertyId());
        metadata.put("client_id", scope.clientId());
        metadata.put("type", type);
        metadata.put("doc_id", docId);
        metadata.put("created_at", createdAt == null ? null : createdAt.toString());
        metadata.put("text", text);
        return metadata;
    }
}
