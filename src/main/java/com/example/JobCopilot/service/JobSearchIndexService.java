package com.example.JobCopilot.service;

import com.example.JobCopilot.config.CopilotProperties;
import com.example.JobCopilot.model.Client;
import com.example.JobCopilot.model.Equipment;
import com.example.JobCopilot.model.Job;
import com.example.JobCopilot.model.JobEvent;
import com.example.JobCopilot.model.JobScope;
import com.example.JobCopilot.model.Note;
import com.example.JobCopilot.model.Property;
import com.example.JobCopilot.model.Technician;
import com.example.JobCopilot.repository.ClientRepository;
import com.example.JobCopilot.repository.EquipmentRepository;
import com.example.JobCopilot.repository.JobEventRepository;
import com.example.JobCopilot.repository.JobRepository;
import com.example.JobCopilot.repository.JobSearchIndexRepository;
import com.example.JobCopilot.repository.NoteRepository;
import com.example.JobCopilot.repository.PropertyRepository;
import com.example.JobCopilot.repository.TechnicianRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Keeps the lexical search row of each job in step with the data it summarizes.
 * <p>
 * A job's search content is its own fields plus the assigned user, client, property,
 * equipment at the property, notes on any of the three scopes and the job's events, lower-cased
 * and whitespace-collapsed. Rows are rebuilt whole: delete, then insert when there is content.
 */
@Service
@RequiredArgsConstructor
public class JobSearchIndexService {

    private static final Logger log = LoggerFactory.getLogger(JobSearchIndexService.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");

    private final JobRepository jobRepository;
    private final TechnicianRepository technicianRepository;
    private final ClientRepository clientRepository;
    private final PropertyRepository propertyRepository;
    private final EquipmentRepository equipmentRepository;
    private final NoteRepository noteRepository;
    private final JobEventRepository jobEventRepository;
    private final JobSearchIndexRepository jobSearchIndexRepository;
    private final CopilotProperties properties;

    /**
     * Normalized search text for the job, or empty when the job does not exist in the tenant
     * or has nothing to index.
     */
    public Optional<String> buildJobSearchContent(String tenantId, String jobId) {
        Optional<Job> found = jobRepository.findById(tenantId, jobId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Job job = found.get();

        Technician assignee = job.assignedUserId() == null
                ? null
                : technicianRepository.findById(tenantId, job.assignedUserId()).orElse(null);
        Client client = clientRepository.findById(tenantId, job.clientId()).orElse(null);
        Property property = propertyRepository.findById(tenantId, job.propertyId()).orElse(null);

        List<Equipment> equipment = equipmentRepository.findByProperty(tenantId, job.propertyId());
        List<Note> notes = noteRepository.findAllForScope(tenantId,
                new JobScope(job.id(), job.clientId(), job.propertyId()));
        List<JobEvent> events = jobEventRepository.findAllByJob(tenantId, job.id());

        List<String> parts = new ArrayList<>();
        parts.add(job.jobType());
        parts.add(job.status());
        parts.add(job.summary());
        parts.add(text(job.scheduledAt()));
        parts.add(text(job.createdAt()));
        parts.add(text(job.updatedAt()));

        if (assignee != null) {
            parts.add(joinNonBlank(assignee.firstName(), assignee.lastName()));
            parts.add(assignee.email());
        }
        if (client != null) {
            parts.add(client.name());
            parts.add(client.primaryPhone());
            parts.add(client.email());
        }
        if (property != null) {
            parts.add(property.addressLine1());
            parts.add(property.addressLine2());
            parts.add(property.city());
            parts.add(property.state());
            parts.add(property.zip());
            parts.add(property.accessNotes());
        }

        parts.add(equipment.stream()
                .map(e -> joinNonBlank(e.type(), e.brand(), e.model(), e.serial()))
                .collect(Collectors.joining(" ")));
        parts.add(notes.stream()
                .map(Note::content)
                .filter(Objects::nonNull)
                .collect(Collectors.joining(" ")));
        parts.add(events.stream()
                .map(e -> joinNonBlank(e.eventType(), e.issue(), e.resolution(), e.partsUsedJson()))
                .collect(Collectors.joining(" ")));

        String content = combine(parts);
        return content.isEmpty() ? Optional.empty() : Optional.of(content);
    }

    /** Rebuilds the job's search row. Safe to repeat; the row ends up the same. */
    @Transactional
    public void upsertJobSearchIndex(String tenantId, String jobId) {
        Optional<String> content = buildJobSearchContent(tenantId, jobId);
        jobSearchIndexRepository.delete(tenantId, jobId);
        content.ifPresent(text -> jobSearchIndexRepository.insert(tenantId, jobId, text, Instant.now()));
    }

    /**
     * Job ids matching every token of the query as a prefix, best match first.
     * A query without alphanumeric tokens matches nothing and does not touch the index.
     */
    public List<String> searchJobIds(String tenantId, String rawQuery) {
        Optional<String> query = buildSearchQuery(rawQuery);
        if (query.isEmpty()) {
            return List.of();
        }
        return jobSearchIndexRepository.search(tenantId, query.get(), properties.getRetrieval().getSearchLimit());
    }

    public int reindexJobsByClient(String tenantId, String clientId) {
        return reindexAll(tenantId, jobRepository.findIdsByClient(tenantId, clientId));
    }

    public int reindexJobsByProperty(String tenantId, String propertyId) {
        return reindexAll(tenantId, jobRepository.findIdsByProperty(tenantId, propertyId));
    }

    public int reindexJobsForTenant(String tenantId) {
        return reindexAll(tenantId, jobRepository.findIdsByTenant(tenantId));
    }

    /**
     * "Oak St." becomes {@code oak:* & st:*}: lower-cased alphanumeric tokens as prefix terms,
     * all required.
     */
    public static Optional<String> buildSearchQuery(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        List<String> tokens = Arrays.stream(NON_ALPHANUMERIC.split(raw.toLowerCase(Locale.ROOT)))
                .filter(token -> !token.isEmpty())
                .toList();
        if (tokens.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(tokens.stream()
                .map(token -> token + ":*")
                .collect(Collectors.joining(" & ")));
    }

    static String normalize(String value) {
        return WHITESPACE.matcher(value.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    private int reindexAll(String tenantId, List<String> jobIds) {
        for (String jobId : jobIds) {
            upsertJobSearchIndex(tenantId, jobId);
        }
        log.info("Reindexed {} job search rows for tenant {}", jobIds.size(), tenantId);
        return jobIds.size();
    }

    private static String combine(List<String> parts) {
        return normalize(parts.stream()
                .filter(part -> part != null && !part.isBlank())
                .collect(Collectors.joining(" ")));
    }

    private static String joinNonBlank(String... values) {
        return Stream.of(values)
                .filter(value -> value != null && !value.isBlank())
                .collect(Collectors.joining(" "));
    }

    private static String text(Instant instant) {
        return instant == null ? null : instant.toString();
    }
}
