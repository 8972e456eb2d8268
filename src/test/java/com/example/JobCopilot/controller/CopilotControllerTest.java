package com.example.JobCopilot.controller;

import com.example.JobCopilot.config.CopilotProperties;
import com.example.JobCopilot.exception.ConfigurationException;
import com.example.JobCopilot.exception.JobNotFoundException;
import com.example.JobCopilot.exception.ValidationException;
import com.example.JobCopilot.model.ChatRequest;
import com.example.JobCopilot.model.ConversationHistory;
import com.example.JobCopilot.model.CopilotAnswer;
import com.example.JobCopilot.model.JobContextSnapshot;
import com.example.JobCopilot.security.AccessAuthException;
import com.example.JobCopilot.security.AccessIdentity;
import com.example.JobCopilot.security.AccessTokenAuthenticator;
import com.example.JobCopilot.security.TenantContext;
import com.example.JobCopilot.service.ConversationMemoryService;
import com.example.JobCopilot.service.CopilotOrchestrator;
import com.example.JobCopilot.service.JobContextService;
import com.example.JobCopilot.support.ControllerTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CopilotControllerTest {

    private static final String CHAT = "{\"message\":\"What was replaced last visit?\"}";

    private JobContextService jobContextService;
    private CopilotOrchestrator orchestrator;
    private ConversationMemoryService memory;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        jobContextService = mock(JobContextService.class);
        orchestrator = mock(CopilotOrchestrator.class);
        memory = mock(ConversationMemoryService.class);
        mockMvc = ControllerTestSupport.mockMvc(new CopilotController(jobContextService, orchestrator, memory));
    }

    @Test
    void contextReturnsSnapshot() throws Exception {
        JobContextSnapshot snapshot = new JobContextSnapshot(
                new JobContextSnapshot.JobDetails("job_1", "hvac_repair", "scheduled", null, "No cooling",
                        null, Instant.parse("2025-06-01T10:00:00Z"), Instant.parse("2025-06-01T10:00:00Z")),
                null, null, List.of(), List.of(), Instant.parse("2025-06-02T08:00:00Z"));
        when(jobContextService.getJobContextSnapshot("tenant_a", "job_1")).thenReturn(snapshot);

        mockMvc.perform(get("/jobs/job_1/ai/context").header("x-tenant-id", "tenant_a"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.job.id").value("job_1"))
                .andExpect(jsonPath("$.job.summary").value("No cooling"))
                .andExpect(jsonPath("$.equipment").isEmpty());
    }

    @Test
    void conversationDefaultsToTheJobSession() throws Exception {
        when(memory.getConversation("tenant_a", "job_1", "session_job_1")).thenReturn(new ConversationHistory(
                "session_job_1",
                List.of(new ConversationHistory.Message("user", "Any warranty?", Instant.parse("2025-06-01T10:00:00Z")),
                        new ConversationHistory.Message("assistant", "Not on record.", Instant.parse("2025-06-01T10:00:01Z")))));

        mockMvc.perform(get("/jobs/job_1/ai/conversation").header("x-tenant-id", "tenant_a"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.session_id").value("session_job_1"))
                .andExpect(jsonPath("$.messages[0].role").value("user"))
                .andExpect(jsonPath("$.messages[1].content").value("Not on record."));
        verify(jobContextService).requireJob("tenant_a", "job_1");
    }

    @Test
    void conversationUsesRequestedSession() throws Exception {
        when(memory.getConversation("tenant_a", "job_1", "session_custom"))
                .thenReturn(new ConversationHistory("session_custom", List.of()));

        mockMvc.perform(get("/jobs/job_1/ai/conversation").param("sessionId", "session_custom")
                        .header("x-tenant-id", "tenant_a"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.session_id").value("session_custom"))
                .andExpect(jsonPath("$.messages").isEmpty());
    }

    @Test
    void conversationForUnknownJobIsNotFound() throws Exception {
        doThrow(new JobNotFoundException("tenant_b", "job_1")).when(jobContextService).requireJob("tenant_b", "job_1");

        mockMvc.perform(get("/jobs/job_1/ai/conversation").header("x-tenant-id", "tenant_b"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Job not found"));
        verifyNoInteractions(memory);
    }

    @Test
    void contextForUnknownJobIsNotFound() throws Exception {
        when(jobContextService.getJobContextSnapshot("tenant_b", "job_1"))
                .thenThrow(new JobNotFoundException("tenant_b", "job_1"));

        mockMvc.perform(get("/jobs/job_1/ai/context").header("x-tenant-id", "tenant_b"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Job not found"));
    }

    @Test
    void sessionIsDerivedFromJobId() throws Exception {
        mockMvc.perform(post("/jobs/job_1/ai/session").header("x-tenant-id", "tenant_a"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionId").value("session_job_1"))
                .andExpect(jsonPath("$.jobId").value("job_1"))
                .andExpect(jsonPath("$.tenantId").value("tenant_a"))
                .andExpect(jsonPath("$.status").value("active"));

        verify(jobContextService).requireJob("tenant_a", "job_1");
    }

    @Test
    void sessionForUnknownJobIsNotFound() throws Exception {
        doThrow(new JobNotFoundException("tenant_a", "job_x")).when(jobContextService).requireJob("tenant_a", "job_x");

        mockMvc.perform(post("/jobs/job_x/ai/session").header("x-tenant-id", "tenant_a"))
                .andExpect(status().isNotFound());
    }

    @Test
    void chatReturnsAnswerWithSnakeCaseFollowUps() throws Exception {
        when(orchestrator.answer(any(TenantContext.class), eq("job_1"), any(ChatRequest.class), eq(false)))
                .thenReturn(new CopilotAnswer("Capacitor was replaced.",
                        List.of(Map.of("doc_id", "note_n1")), List.of("Check the filter?"), null));

        mockMvc.perform(post("/jobs/job_1/ai/chat")
                        .header("x-tenant-id", "tenant_a")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CHAT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("Capacitor was replaced."))
                .andExpect(jsonPath("$.citations[0].doc_id").value("note_n1"))
                .andExpect(jsonPath("$.follow_ups[0]").value("Check the filter?"))
                .andExpect(jsonPath("$.debug").doesNotExist());
    }

    @Test
    void debugHeaderTurnsOnDiagnostics() throws Exception {
        when(orchestrator.answer(any(TenantContext.class), eq("job_1"), any(ChatRequest.class), anyBoolean()))
                .thenReturn(new CopilotAnswer("ok", List.of(), List.of(), null));

        mockMvc.perform(post("/jobs/job_1/ai/chat")
                        .header("x-tenant-id", "tenant_a")
                        .header("x-debug", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CHAT))
                .andExpect(status().isOk());

        verify(orchestrator).answer(any(TenantContext.class), eq("job_1"), any(ChatRequest.class), eq(true));
    }

    @Test
    void chatErrorsMapToJsonBodies() throws Exception {
        when(orchestrator.answer(any(TenantContext.class), eq("job_1"), any(), anyBoolean()))
                .thenThrow(ValidationException.missing("message"));
        when(orchestrator.answer(any(TenantContext.class), eq("job_2"), any(), anyBoolean()))
                .thenThrow(new ConfigurationException("Missing OpenAI API key"));

        mockMvc.perform(post("/jobs/job_1/ai/chat").header("x-tenant-id", "tenant_a"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing message"));
        mockMvc.perform(post("/jobs/job_2/ai/chat").header("x-tenant-id", "tenant_a"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Missing OpenAI API key"));
    }

    @Test
    void verifiedTokenForAnotherTenantIsForbidden() throws Exception {
        AccessTokenAuthenticator authenticator = mock(AccessTokenAuthenticator.class);
        when(authenticator.authenticate(eq("token-1"), any(), any(), any()))
                .thenReturn(new AccessIdentity("user_1", "tenant_b", "technician", "tech@example.com"));
        MockMvc secured = ControllerTestSupport.mockMvc(
                new CopilotController(jobContextService, orchestrator, memory), accessEnabled(), authenticator);

        secured.perform(get("/jobs/job_1/ai/context")
                        .header("x-tenant-id", "tenant_a")
                        .header("Authorization", "Bearer token-1"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("Tenant mismatch"));

        verifyNoInteractions(jobContextService);
    }

    @Test
    void missingTokenIsUnauthorizedWhenAccessIsEnabled() throws Exception {
        AccessTokenAuthenticator authenticator = mock(AccessTokenAuthenticator.class);
        when(authenticator.authenticate(eq(null), any(), any(), any()))
                .thenThrow(AccessAuthException.unauthorized("Missing access token"));
        MockMvc secured = ControllerTestSupport.mockMvc(
                new CopilotController(jobContextService, orchestrator, memory), accessEnabled(), authenticator);

        secured.perform(post("/jobs/job_1/ai/chat")
                        .header("x-tenant-id", "tenant_a")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CHAT))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Missing access token"));

        verify(orchestrator, never()).answer(any(), any(), any(), anyBoolean());
    }

    private static CopilotProperties accessEnabled() {
        CopilotProperties properties = new CopilotProperties();
        properties.getAccess().setEnabled(true);
        properties.getAccess().setJwksUrl("https://team.example.com/cdn-cgi/access/certs");
        properties.getAccess().setAudience("aud-1");
        return properties;
    }
}
