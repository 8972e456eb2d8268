package com.example.JobCopilot.security;

import com.example.JobCopilot.config.CopilotProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AdminTokenVerifierTest {

    @Test
    void matchingTokenPasses() {
        AdminTokenVerifier verifier = verifier("s3cret");

        assertThat(verifier.isConfigured()).isTrue();
        assertThatCode(() -> verifier.verify("s3cret")).doesNotThrowAnyException();
    }

    @Test
    void wrongOrMissingTokenIsUnauthorized() {
        AdminTokenVerifier verifier = verifier("s3cret");

        assertThatThrownBy(() -> verifier.verify("s3cre")).isInstanceOf(AccessAuthException.class).hasMessage("Unauthorized");
        assertThatThrownBy(() -> verifier.verify(null)).isInstanceOf(AccessAuthException.class);
    }

    @Test
    void unconfiguredTokenRejectsEveryCall() {
        AdminTokenVerifier verifier = verifier("  ");

        assertThat(verifier.isConfigured()).isFalse();
        assertThatThrownBy(() -> verifier.verify("  ")).isInstanceOf(AccessAuthException.class);
    }

    private static AdminTokenVerifier verifier(String token) {
        CopilotProperties properties = new CopilotProperties();
        properties.getVector().setAdminToken(token);
        return new AdminTokenVerifier(properties);
    }
}
