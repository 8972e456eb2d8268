package com.example.JobCopilot.controller;

import com.example.JobCopilot.config.CopilotProperties;
import com.example.JobCopilot.exception.ConfigurationException;
import com.example.JobCopilot.security.AdminTokenVerifier;
import com.example.JobCopilot.security.TenantContext;
import com.example.JobCopilot.service.JobSearchIndexService;
import com.example.JobCopilot.service.VectorIndexingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator routes that rebuild the lexical and vector indexes. Both require {@code x-api-key}.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ReindexController {

    static final String API_KEY_HEADER = "x-api-key";

    private final VectorIndexingService vectorIndexingService;
    private final JobSearchIndexService jobSearchIndexService;
    private final AdminTokenVerifier adminTokenVerifier;
    private final CopilotProperties properties;

    @PostMapping("/vectorize/reindex/job/{jobId}")
    public Map<String, Object> reindexJobVectors(TenantContext tenant,
                                                 @PathVariable String jobId,
                                                 @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey) {
        if (!properties.getVector().isEnabled()) {
            throw new ConfigurationException("Vectorize index not configured");
        }
        String modelKey = properties.getModel().getApiKey();
        if (modelKey == null || modelKey.isBlank()) {
            throw new ConfigurationException("Missing OpenAI API key");
        }
        adminTokenVerifier.verify(apiKey);

        int indexed = vectorIndexingService.reindexJobEvidence(tenant.tenantId(), jobId);
        return ok("indexed", indexed);
    }

    @PostMapping("/search/reindex")
    public Map<String, Object> reindexSearch(TenantContext tenant,
                                             @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey) {
        adminTokenVerifier.verify(apiKey);
        int reindexed = jobSearchIndexService.reindexJobsForTenant(tenant.tenantId());
        log.info("Rebuilt lexical index for {} jobs in tenant {}", reindexed, tenant.tenantId());
        return ok("reindexed", reindexed);
    }

    private static Map<String, Object> ok(String key, int count) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put(key, count);
        return body;
    }
}
