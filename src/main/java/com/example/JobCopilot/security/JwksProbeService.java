package com.example.JobCopilot.security;

import com.example.JobCopilot.config.CopilotProperties;
import com.example.JobCopilot.exception.UpstreamException;
import com.example.JobCopilot.exception.ValidationException;
import com.example.JobCopilot.model.JwksProbe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;

/**
 * Fetches the configured JWKS URL and reports what came back, for diagnosing a misconfigured
 * access gateway. Non-2xx answers are reported, not thrown.
 */
@Slf4j
@Service
public class JwksProbeService {

    static final int SNIPPET_LENGTH = 200;

    private final RestClient restClient;
    private final CopilotProperties properties;

    public JwksProbeService(RestClient.Builder restClientBuilder, CopilotProperties properties) {
        this.restClient = restClientBuilder.build();
        this.properties = properties;
    }

    public JwksProbe probe() {
        String jwksUrl = properties.getAccess().getJwksUrl();
        if (jwksUrl == null || jwksUrl.isBlank()) {
            throw new ValidationException("JWKS URL not set");
        }
        try {
            return restClient.get()
                    .uri(jwksUrl)
                    .exchange((request, response) -> {
                        String body = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
                        String contentType = response.getHeaders().getFirst(HttpHeaders.CONTENT_TYPE);
                        return new JwksProbe(
                                jwksUrl,
                                response.getStatusCode().value(),
                                contentType == null ? "unknown" : contentType,
                                snippet(body));
                    });
        } catch (RestClientException e) {
            log.warn("JWKS probe of {} failed: {}", jwksUrl, e.getMessage());
            throw new UpstreamException("Failed to fetch JWKS", e);
        }
    }

    static String snippet(String body) {
        if (body == null) {
            return "";
        }
        String head = body.length() > SNIPPET_LENGTH ? body.substring(0, SNIPPET_LENGTH) : body;
        return head.replaceAll("\\s+", " ");
    }
}
