package com.example.JobCopilot.security;

import com.example.JobCopilot.config.CopilotProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Guards operator routes with the shared {@code copilot.vector.admin-token}.
 * No configured token means every call is rejected.
 */
@Component
@RequiredArgsConstructor
public class AdminTokenVerifier {

    private final CopilotProperties properties;

    public boolean isConfigured() {
        String expected = properties.getVector().getAdminToken();
        return expected != null && !expected.isBlank();
    }

    public void verify(String provided) {
        if (!isConfigured() || provided == null) {
            throw AccessAuthException.unauthorized("Unauthorized");
        }
        byte[] expected = properties.getVector().getAdminToken().getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(expected, provided.getBytes(StandardCharsets.UTF_8))) {
            throw AccessAuthException.unauthorized("Unauthorized");
        }
    }
}
