package com.example.JobCopilot.service;

import com.example.JobCopilot.config.CopilotProperties;
import com.example.JobCopilot.exception.ConflictException;
import com.example.JobCopilot.exception.JobNotFoundException;
import com.example.JobCopilot.exception.NotFoundException;
import com.example.JobCopilot.exception.ValidationException;
import com.example.JobCopilot.model.Client;
import com.example.JobCopilot.model.ClientIngestRequest;
import com.example.JobCopilot.model.IngestResult;
import com.example.JobCopilot.model.Job;
import com.example.JobCopilot.model.JobIngestRequest;
import com.example.JobCopilot.model.NewNote;
import com.example.JobCopilot.model.NoteIngestRequest;
import com.example.JobCopilot.model.Property;
import com.example.JobCopilot.model.PropertyIngestRequest;
import com.example.JobCopilot.repository.ClientRepository;
import com.example.JobCopilot.repository.JobRepository;
import com.example.JobCopilot.repository.NoteRepository;
import com.example.JobCopilot.repository.PropertyRepository;
import com.example.JobCopilot.security.TenantContext;
import com.example.JobCopilot.util.RequestFields;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static com.example.JobCopilot.util.RequestFields.optional;
import static com.example.JobCopilot.util.RequestFields.orDefault;
import static com.example.JobCopilot.util.RequestFields.required;

/**
 * Creates clients, properties, jobs and notes for the caller's tenant and schedules the
 * search index refresh each write makes necessary. Reindexing never blocks or fails the write.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {

    static final String DEFAULT_CLIENT_TYPE = "residential";
    static final String DEFAULT_JOB_STATUS = "scheduled";
    static final String DEFAULT_NOTE_TYPE = "tech";

    private static final Set<String> NOTE_ENTITY_TYPES = Set.of("job", "client", "property");

    private final ClientRepository clientRepository;
    private final PropertyRepository propertyRepository;
    private final JobRepository jobRepository;
    private final NoteRepository noteRepository;
    private final JobSearchIndexService jobSearchIndexService;
    private final VectorIndexingService vectorIndexingService;
    private final BackgroundTaskRunner backgroundTaskRunner;
    private final CopilotProperties properties;

    public IngestResult createClient(TenantContext tenant, ClientIngestRequest request) {
        ClientIngestRequest body = requireBody(request);
        String name = required(body.name(), "name");
        String tenantId = tenant.tenantId();
        String id = idOrNew(body.id());
        Instant now = Instant.now();

        clientRepository.insert(tenantId, new Client(
                id,
                name,
                orDefault(body.type(), DEFAULT_CLIENT_TYPE),
                optional(body.primaryPhone()),
                optional(body.email()),
                cleanTags(body.tags()),
                now,
                now));
        log.info("Ingested client {} for tenant {}", id, tenantId);

        backgroundTaskRunner.submit("reindex-client-" + id,
                () -> jobSearchIndexService.reindexJobsByClient(tenantId, id));
        return IngestResult.created(id);
    }

    public IngestResult createProperty(TenantContext tenant, PropertyIngestRequest request) {
        PropertyIngestRequest body = requireBody(request);
        String clientId = required(body.clientId(), "clientId");
        String addressLine1 = required(body.addressLine1(), "addressLine1");
        String city = required(body.city(), "city");
        String state = required(body.state(), "state");
        String zip = required(body.zip(), "zip");
        String tenantId = tenant.tenantId();

        if (!clientRepository.exists(tenantId, clientId)) {
            throw new NotFoundException("Client not found");
        }

        String id = idOrNew(body.id());
        propertyRepository.insert(tenantId, new Property(
                id,
                clientId,
                addressLine1,
                optional(body.addressLine2()),
                city,
                state,
                zip,
                optional(body.accessNotes()),
                Instant.now()));
        log.info("Ingested property {} for client {} in tenant {}", id, clientId, tenantId);

        backgroundTaskRunner.submit("reindex-property-" + id,
                () -> jobSearchIndexService.reindexJobsByProperty(tenantId, id));
        return IngestResult.created(id);
    }

    public IngestResult createJob(TenantContext tenant, JobIngestRequest request) {
        JobIngestRequest body = requireBody(request);
        String jobType = required(body.jobType(), "jobType");
        String clientId = required(body.clientId(), "clientId");
        String propertyId = required(body.propertyId(), "propertyId");
        Instant scheduledAt = RequestFields.instant(body.scheduledAt(), "scheduledAt");
        String tenantId = tenant.tenantId();

        if (!clientRepository.exists(tenantId, clientId)) {
            throw new NotFoundException("Client not found");
        }
        String owner = propertyRepository.findClientId(tenantId, propertyId)
                .orElseThrow(() -> new NotFoundException("Property not found"));
        if (!owner.equals(clientId)) {
            throw new ValidationException("Property does not belong to client");
        }

        String id = idOrNew(body.id());
        Instant now = Instant.now();
        jobRepository.insert(tenantId, new Job(
                id,
                clientId,
                propertyId,
                jobType,
                orDefault(body.status(), DEFAULT_JOB_STATUS),
                scheduledAt,
                optional(body.assignedUserId()),
                optional(body.summary()),
                now,
                now));
        log.info("Ingested job {} for tenant {}", id, tenantId);

        backgroundTaskRunner.submit("reindex-job-" + id,
                () -> jobSearchIndexService.upsertJobSearchIndex(tenantId, id));
        return IngestResult.created(id);
    }

    /**
     * Creates a note. With an idempotency key a retried request returns the original note id
     * instead of inserting again; a key that collides without a stored note is a conflict.
     */
    public IngestResult createNote(TenantContext tenant, NoteIngestRequest request, String idempotencyKey) {
        NoteIngestRequest body = requireBody(request);
        String entityType = required(body.entityType(), "entityType");
        String entityId = required(body.entityId(), "entityId");
        String content = required(body.content(), "content");
        String jobId = required(body.jobId(), "jobId");
        if (!NOTE_ENTITY_TYPES.contains(entityType)) {
            throw new ValidationException("Invalid entityType");
        }
        String tenantId = tenant.tenantId();
        String key = optional(idempotencyKey);

        if (!jobRepository.exists(tenantId, jobId)) {
            throw new JobNotFoundException(tenantId, jobId);
        }

        String id = idOrNew(body.id());
        NewNote note = new NewNote(
                tenantId,
                id,
                entityType,
                entityId,
                orDefault(body.noteType(), DEFAULT_NOTE_TYPE),
                content,
                tenant.userId(),
                key);

        int inserted = noteRepository.insert(note, Instant.now(), key != null);
        if (key != null && inserted == 0) {
            Optional<String> existing = noteRepository.findIdByIdempotencyKey(tenantId, key);
            if (existing.isPresent()) {
                log.info("Replayed note {} for idempotency key in tenant {}", existing.get(), tenantId);
                return IngestResult.replayed(existing.get());
            }
            throw new ConflictException("Idempotency key already used");
        }
        log.info("Ingested note {} on {} {} for job {} in tenant {}", id, entityType, entityId, jobId, tenantId);

        backgroundTaskRunner.submit("reindex-note-" + id, () -> reindexAfterNote(tenantId, jobId));
        return IngestResult.created(id);
    }

    private void reindexAfterNote(String tenantId, String jobId) {
        jobSearchIndexService.upsertJobSearchIndex(tenantId, jobId);
        if (!vectorIndexingEnabled()) {
            return;
        }
        try {
            vectorIndexingService.reindexJobEvidence(tenantId, jobId);
        } catch (JobNotFoundException e) {
            log.warn("Vector reindex skipped, job {} not found in tenant {}", jobId, tenantId);
        }
    }

    private boolean vectorIndexingEnabled() {
        return properties.getVector().isEnabled() && optional(properties.getModel().getApiKey()) != null;
    }

    private static <T> T requireBody(T body) {
        if (body == null) {
            throw new ValidationException("Invalid JSON");
        }
        return body;
    }

    private static String idOrNew(String id) {
        return orDefault(id, UUID.randomUUID().toString());
    }

    private static List<String> cleanTags(List<String> tags) {
        if (tags == null) {
            return List.of();
        }
        return tags.stream()
                .map(RequestFields::optional)
                .filter(Objects::nonNull)
                .distinct()
                .toList();
    }
}
