package com.example.JobCopilot.controller;

import com.example.JobCopilot.model.ClientIngestRequest;
import com.example.JobCopilot.model.IngestResult;
import com.example.JobCopilot.model.JobIngestRequest;
import com.example.JobCopilot.model.NoteIngestRequest;
import com.example.JobCopilot.model.PropertyIngestRequest;
import com.example.JobCopilot.security.TenantContext;
import com.example.JobCopilot.service.IngestionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/ingest")
@RequiredArgsConstructor
public class IngestController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final IngestionService ingestionService;

    @PostMapping("/clients")
    @ResponseStatus(HttpStatus.CREATED)
    public IngestResult createClient(TenantContext tenant, @RequestBody(required = false) ClientIngestRequest request) {
        return ingestionService.createClient(tenant, request);
    }

    @PostMapping("/properties")
    @ResponseStatus(HttpStatus.CREATED)
    public IngestResult createProperty(TenantContext tenant, @RequestBody(required = false) PropertyIngestRequest request) {
        return ingestionService.createProperty(tenant, request);
    }

    @PostMapping("/jobs")
    @ResponseStatus(HttpStatus.CREATED)
    public IngestResult createJob(TenantContext tenant, @RequestBody(required = false) JobIngestRequest request) {
        return ingestionService.createJob(tenant, request);
    }

    /** 201 for a new note, 200 with {@code idempotent: true} when the key was already used. */
    @PostMapping("/notes")
    public ResponseEntity<IngestResult> createNote(TenantContext tenant,
                                                   @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
                                                   @RequestBody(required = false) NoteIngestRequest request) {
        IngestResult result = ingestionService.createNote(tenant, request, idempotencyKey);
        return ResponseEntity.status(result.isReplay() ? HttpStatus.OK : HttpStatus.CREATED).body(result);
    }
}
