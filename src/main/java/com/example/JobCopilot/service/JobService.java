package com.example.JobCopilot.service;

import com.example.JobCopilot.exception.JobNotFoundException;
import com.example.JobCopilot.exception.NotFoundException;
import com.example.JobCopilot.exception.ValidationException;
import com.example.JobCopilot.model.Job;
import com.example.JobCopilot.model.JobAssignRequest;
import com.example.JobCopilot.model.JobCreateRequest;
import com.example.JobCopilot.model.JobFilter;
import com.example.JobCopilot.model.JobSummary;
import com.example.JobCopilot.model.Note;
import com.example.JobCopilot.model.PageResult;
import com.example.JobCopilot.repository.ClientRepository;
import com.example.JobCopilot.repository.JobRepository;
import com.example.JobCopilot.repository.NoteRepository;
import com.example.JobCopilot.repository.PropertyRepository;
import com.example.JobCopilot.repository.TechnicianRepository;
import com.example.JobCopilot.util.RequestFields;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.UUID;

import static com.example.JobCopilot.util.RequestFields.optional;
import static com.example.JobCopilot.util.RequestFields.orDefault;

/**
 * Job board operations for the caller's tenant. Creating or assigning a job schedules a
 * refresh of its search index entry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobService {

    static final String DEFAULT_STATUS = "scheduled";

    private final JobRepository jobRepository;
    private final ClientRepository clientRepository;
    private final PropertyRepository propertyRepository;
    private final TechnicianRepository technicianRepository;
    private final NoteRepository noteRepository;
    private final JobSearchIndexService jobSearchIndexService;
    private final BackgroundTaskRunner backgroundTaskRunner;

    /**
     * Unparseable {@code start}/{@code end} values are ignored, and the window is applied
     * only when both ends are given.
     */
    public PageResult<JobSummary> listJobs(String tenantId, String clientId, String status, String type,
                                           String assignedUserId, String start, String end) {
        JobFilter filter = new JobFilter(
                optional(clientId),
                optional(status),
                optional(type),
                optional(assignedUserId),
                parseDateParam(start),
                parseDateParam(end));
        return PageResult.of(jobRepository.search(tenantId, filter));
    }

    public JobSummary getJob(String tenantId, String jobId) {
        return jobRepository.findSummary(tenantId, jobId)
                .orElseThrow(() -> new JobNotFoundException(tenantId, jobId));
    }

    /**
     * Creates a job; without a {@code propertyId} the client's oldest property is used.
     *
     * @return id of the new job
     */
    public String createJob(String tenantId, JobCreateRequest request) {
        String clientId = request == null ? null : optional(request.clientId());
        String jobType = request == null ? null : optional(request.jobType());
        if (clientId == null || jobType == null) {
            throw new ValidationException("Missing clientId or jobType");
        }
        Instant scheduledAt = RequestFields.instant(request.scheduledAt(), "scheduledAt");
        if (!clientRepository.exists(tenantId, clientId)) {
            throw new NotFoundException("Client not found");
        }

        String propertyId = optional(request.propertyId());
        if (propertyId == null) {
            propertyId = propertyRepository.findFirstIdByClient(tenantId, clientId)
                    .orElseThrow(() -> new ValidationException("Property not found for client"));
        } else {
            String owner = propertyRepository.findClientId(tenantId, propertyId)
                    .orElseThrow(() -> new NotFoundException("Property not found"));
            if (!owner.equals(clientId)) {
                throw new ValidationException("Property does not belong to client");
            }
        }

        String id = UUID.randomUUID().toString();
        Instant now = Instant.now();
        jobRepository.insert(tenantId, new Job(
                id,
                clientId,
                propertyId,
                jobType,
                orDefault(request.status(), DEFAULT_STATUS),
                scheduledAt,
                null,
                optional(request.summary()),
                now,
                now));
        log.info("Created job {} for client {} in tenant {}", id, clientId, tenantId);

        scheduleReindex(tenantId, id);
        return id;
    }

    /** Assigns a technician of the same tenant and moves the job to {@code assigned}. */
    public String assignJob(String tenantId, String jobId, JobAssignRequest request) {
        String technicianId = request == null ? null : optional(request.technicianId());
        if (technicianId == null) {
            throw ValidationException.missing("technicianId");
        }
        if (technicianRepository.findById(tenantId, technicianId).isEmpty()) {
            throw new NotFoundException("Technician not found");
        }
        if (jobRepository.assign(tenantId, jobId, technicianId, Instant.now()) == 0) {
            throw new JobNotFoundException(tenantId, jobId);
        }
        log.info("Assigned job {} to {} in tenant {}", jobId, technicianId, tenantId);

        scheduleReindex(tenantId, jobId);
        return jobId;
    }

    public PageResult<Note> listNotes(String tenantId, String jobId) {
        if (!jobRepository.exists(tenantId, jobId)) {
            throw new JobNotFoundException(tenantId, jobId);
        }
        return PageResult.of(noteRepository.findByJob(tenantId, jobId));
    }

    private void scheduleReindex(String tenantId, String jobId) {
        backgroundTaskRunner.submit("reindex-job-" + jobId,
                () -> jobSearchIndexService.upsertJobSearchIndex(tenantId, jobId));
    }

    // Accepts a full instant or a plain date (start of day UTC)
    static Instant parseDateParam(String value) {
        String text = optional(value);
        if (text == null) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
            } catch (DateTimeParseException ignored) {
                log.debug("Ignoring unparseable date filter '{}'", text);
                return null;
            }
        }
    }
}
