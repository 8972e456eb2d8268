package com.example.JobCopilot.controller;

import com.example.JobCopilot.model.JobAssignRequest;
import com.example.JobCopilot.model.JobCreateRequest;
import com.example.JobCopilot.model.JobSummary;
import com.example.JobCopilot.model.Note;
import com.example.JobCopilot.model.PageResult;
import com.example.JobCopilot.security.TenantContext;
import com.example.JobCopilot.service.JobService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/jobs")
@RequiredArgsConstructor
public class JobController {

    private final JobService jobService;

    @GetMapping
    public PageResult<JobSummary> list(TenantContext tenant,
                                       @RequestParam(required = false) String clientId,
                                       @RequestParam(required = false) String status,
                                       @RequestParam(required = false) String type,
                                       @RequestParam(required = false) String assignedUserId,
                                       @RequestParam(required = false) String start,
                                       @RequestParam(required = false) String end) {
        return jobService.listJobs(tenant.tenantId(), clientId, status, type, assignedUserId, start, end);
    }

    @GetMapping("/{jobId}")
    public JobSummary get(TenantContext tenant, @PathVariable String jobId) {
        return jobService.getJob(tenant.tenantId(), jobId);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, String> create(TenantContext tenant, @RequestBody(required = false) JobCreateRequest request) {
        return Map.of("id", jobService.createJob(tenant.tenantId(), request));
    }

    @PostMapping("/{jobId}/assign")
    public Map<String, String> assign(TenantContext tenant,
                                      @PathVariable String jobId,
                                      @RequestBody(required = false) JobAssignRequest request) {
        return Map.of("id", jobService.assignJob(tenant.tenantId(), jobId, request));
    }

    @GetMapping("/{jobId}/notes")
    public PageResult<Note> notes(TenantContext tenant, @PathVariable String jobId) {
        return jobService.listNotes(tenant.tenantId(), jobId);
    }
}
