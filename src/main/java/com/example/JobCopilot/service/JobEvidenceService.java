package com.example.JobCopilot.service;

import com.example.JobCopilot.model.EvidenceItem;
import com.example.JobCopilot.model.JobEvent;
import com.example.JobCopilot.model.JobScope;
import com.example.JobCopilot.model.Note;
import com.example.JobCopilot.repository.JobEventRepository;
import com.example.JobCopilot.repository.JobRepository;
import com.example.JobCopilot.repository.NoteRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Citable evidence for a job: notes on the job, its client and its property, plus the
 * job's events. Newest first; on equal dates notes come before events.
 */
@Service
@RequiredArgsConstructor
public class JobEvidenceService {

    static final String SNIPPET_SEPARATOR = " — ";

    private static final Comparator<EvidenceItem> NEWEST_FIRST =
            Comparator.comparing(EvidenceItem::date, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private final JobRepository jobRepository;
    private final NoteRepository noteRepository;
    private final JobEventRepository jobEventRepository;

    /** Empty when the job does not exist in the tenant. */
    public List<EvidenceItem> getJobEvidence(String tenantId, String jobId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Optional<JobScope> scope = jobRepository.findScope(tenantId, jobId);
        if (scope.isEmpty()) {
            return List.of();
        }

        List<EvidenceItem> items = new ArrayList<>();
        for (Note note : noteRepository.findRecentForScope(tenantId, scope.get(), limit)) {
            items.add(EvidenceItem.stored(note.id(), EvidenceItem.TYPE_NOTE, note.entityType(),
                    note.createdAt(), note.content(), note.authorName()));
        }
        for (JobEvent event : jobEventRepository.findRecentByJob(tenantId, jobId, limit)) {
            items.add(EvidenceItem.stored(event.id(), EvidenceItem.TYPE_JOB_EVENT, "job",
                    event.createdAt(), eventSnippet(event), null));
        }

        // List.sort is stable, so notes stay ahead of events on equal dates
        items.sort(NEWEST_FIRST);
        return items.size() > limit ? List.copyOf(items.subList(0, limit)) : items;
    }

    static String eventSnippet(JobEvent event) {
        return Stream.of(event.eventType(), event.issue(), event.resolution())
                .filter(part -> part != null && !part.isBlank())
                .collect(Collectors.joining(SNIPPET_SEPARATOR));
    }
}
