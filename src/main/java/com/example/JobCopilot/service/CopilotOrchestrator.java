package com.example.JobCopilot.service;

import com.example.JobCopilot.config.CopilotProperties;
import com.example.JobCopilot.exception.ConfigurationException;
import com.example.JobCopilot.exception.ValidationException;
import com.example.JobCopilot.model.ChatCompletionRequest;
import com.example.JobCopilot.model.ChatDebug;
import com.example.JobCopilot.model.ChatRequest;
import com.example.JobCopilot.model.CopilotAnswer;
import com.example.JobCopilot.model.EvidenceItem;
import com.example.JobCopilot.model.JobContextSnapshot;
import com.example.JobCopilot.model.ParsedResponse;
import com.example.JobCopilot.model.PromptMessage;
import com.example.JobCopilot.model.SessionDescriptor;
import com.example.JobCopilot.model.VectorDiagnostics;
import com.example.JobCopilot.model.VectorRetrievalResult;
import com.example.JobCopilot.security.TenantContext;
import com.example.JobCopilot.util.RequestFields;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Answers a technician's question about one job:
 * - Loads the job snapshot (404 when the job is not in the tenant)
 * - Gathers lexical evidence and vector evidence
 * - Builds the versioned prompt with the session history
 * - Calls the model and parses its reply defensively
 * - Stores the turn in conversation memory and the audit log
 */
@Service
@RequiredArgsConstructor
public class CopilotOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CopilotOrchestrator.class);

    private final JobContextService jobContextService;
    private final JobEvidenceService jobEvidenceService;
    private final VectorRetrievalService vectorRetrievalService;
    private final EvidenceFormatter evidenceFormatter;
    private final PromptBuilder promptBuilder;
    private final ChatModelProvider chatModelProvider;
    private final ResponseParser responseParser;
    private final ConversationMemoryService conversationMemoryService;
    private final CopilotAuditService copilotAuditService;
    private final CopilotProperties properties;
    private final ObjectMapper objectMapper;

    public CopilotAnswer answer(TenantContext tenant, String jobId, ChatRequest request, boolean debug) {
        long startedAt = System.currentTimeMillis();

        // 1. Provider credentials and a non-empty question
        if (RequestFields.optional(properties.getModel().getApiKey()) == null) {
            throw new ConfigurationException("Missing OpenAI API key");
        }
        String message = RequestFields.optional(request == null ? null : request.message());
        if (message == null) {
            throw ValidationException.missing("message");
        }
        String sessionId = RequestFields.orDefault(
                request.sessionId(), SessionDescriptor.sessionIdFor(jobId));
        String tenantId = tenant.tenantId();

        // 2. Structured context; throws JobNotFoundException for foreign or missing jobs
        JobContextSnapshot snapshot = jobContextService.getJobContextSnapshot(tenantId, jobId);

        // 3. Evidence: lexical first, vector matches as a separate section
        CopilotProperties.Retrieval retrieval = properties.getRetrieval();
        List<EvidenceItem> evidence = jobEvidenceService.getJobEvidence(tenantId, jobId, retrieval.getEvidenceLimit());
        VectorRetrievalResult vector = vectorRetrievalService.retrieve(tenantId, jobId, message, debug);

        // 4. Prompt
        String promptVersion = PromptTemplates.resolveVersion(properties.getPrompt().getVersion());
        List<PromptMessage> history = loadHistory(tenantId, jobId, sessionId, retrieval.getHistoryLimit());
        List<PromptMessage> messages = promptBuilder.build(
                promptVersion,
                toJson(snapshot),
                evidenceFormatter.format(evidence, vector.evidence()),
                history,
                message);

        // 5. Model call and defensive parsing
        CopilotProperties.Model model = properties.getModel();
        log.debug("Copilot request for job {} (model={}, prompt={}, evidence={}, vector={})",
                jobId, model.getName(), promptVersion, evidence.size(), vector.evidence().size());
        String raw = chatModelProvider.complete(new ChatCompletionRequest(
                model.getName(),
                model.getTemperature(),
                model.getTopP(),
                model.getMaxTokens(),
                model.isJsonMode(),
                messages));
        ParsedResponse parsed = responseParser.parse(raw);

        // 6. Best-effort persistence
        saveHistory(tenantId, jobId, sessionId, message, parsed.answer());
        copilotAuditService.recordTurn(new CopilotAuditService.Turn(
                tenantId,
                jobId,
                tenant.userId(),
                sessionId,
                model.getName(),
                promptVersion,
                message,
                parsed.answer(),
                auditMetadata(parsed, evidence.size(), vector.diagnostics())));

        log.info("Copilot answered job {} in {} ms ({} citations, {} follow-ups)",
                jobId, System.currentTimeMillis() - startedAt, parsed.citations().size(), parsed.followUps().size());

        return new CopilotAnswer(
                parsed.answer(),
                parsed.citations(),
                parsed.followUps(),
                debug ? debugInfo(evidence.size(), vector.diagnostics()) : null);
    }

    private List<PromptMessage> loadHistory(String tenantId, String jobId, String sessionId, int limit) {
        try {
            return ConversationMemoryService.toPromptMessages(
                    conversationMemoryService.loadHistory(tenantId, jobId, sessionId, limit));
        } catch (DataAccessException e) {
            log.warn("Conversation history unavailable for session {}: {}", sessionId, e.getMessage());
            return List.of();
        }
    }

    private void saveHistory(String tenantId, String jobId, String sessionId, String question, String answer) {
        try {
            conversationMemoryService.appendTurn(tenantId, jobId, sessionId, question, answer);
        } catch (DataAccessException e) {
            log.warn("Failed to store conversation turn for session {}: {}", sessionId, e.getMessage());
        }
    }

    private String toJson(JobContextSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Job context is not serializable", e);
        }
    }

    private static ChatDebug debugInfo(int evidenceCount, VectorDiagnostics diagnostics) {
        return new ChatDebug(
                diagnostics.vectorEnabled(),
                diagnostics.vectorMatches(),
                evidenceCount,
                diagnostics.filterRequested(),
                diagnostics.filterUsed(),
                diagnostics.filterErrors(),
                diagnostics.unfilteredMatches(),
                diagnostics.vectorMetadata(),
                diagnostics.fallbackUsed());
    }

    private static Map<String, Object> auditMetadata(ParsedResponse parsed, int evidenceCount,
                                                     VectorDiagnostics diagnostics) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("citations", parsed.citations());
        metadata.put("followUps", parsed.followUps());
        metadata.put("evidenceCount", evidenceCount);
        metadata.put("vectorMatches", diagnostics.vectorMatches());
        metadata.put("vectorFallbackUsed", diagnostics.fallbackUsed());
        return metadata;
    }
}
