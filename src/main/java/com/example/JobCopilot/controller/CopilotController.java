package com.example.JobCopilot.controller;

import com.example.JobCopilot.model.ChatRequest;
import com.example.JobCopilot.model.ConversationHistory;
import com.example.JobCopilot.model.CopilotAnswer;
import com.example.JobCopilot.model.JobContextSnapshot;
import com.example.JobCopilot.model.SessionDescriptor;
import com.example.JobCopilot.security.TenantContext;
import com.example.JobCopilot.service.ConversationMemoryService;
import com.example.JobCopilot.service.CopilotOrchestrator;
import com.example.JobCopilot.service.JobContextService;
import com.example.JobCopilot.util.RequestFields;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/jobs/{jobId}/ai")
@RequiredArgsConstructor
public class CopilotController {

    static final String DEBUG_HEADER = "x-debug";

    private final JobContextService jobContextService;
    private final CopilotOrchestrator copilotOrchestrator;
    private final ConversationMemoryService conversationMemoryService;

    @GetMapping("/context")
    public JobContextSnapshot context(TenantContext tenant, @PathVariable String jobId) {
        return jobContextService.getJobContextSnapshot(tenant.tenantId(), jobId);
    }

    @PostMapping("/session")
    public SessionDescriptor session(TenantContext tenant, @PathVariable String jobId) {
        jobContextService.requireJob(tenant.tenantId(), jobId);
        return SessionDescriptor.active(tenant.tenantId(), jobId);
    }

    /** Stored turns of the job's default session, or of {@code sessionId} when given. */
    @GetMapping("/conversation")
    public ConversationHistory conversation(TenantContext tenant,
                                            @PathVariable String jobId,
                                            @RequestParam(required = false) String sessionId) {
        jobContextService.requireJob(tenant.tenantId(), jobId);
        return conversationMemoryService.getConversation(
                tenant.tenantId(), jobId, RequestFields.orDefault(sessionId, SessionDescriptor.sessionIdFor(jobId)));
    }

    @PostMapping("/chat")
    public CopilotAnswer chat(TenantContext tenant,
                              @PathVariable String jobId,
                              @RequestHeader(value = DEBUG_HEADER, required = false) String debug,
                              @RequestBody(required = false) ChatRequest request) {
        return copilotOrchestrator.answer(tenant, jobId, request, "1".equals(debug) || "true".equalsIgnoreCase(debug));
    }
}
