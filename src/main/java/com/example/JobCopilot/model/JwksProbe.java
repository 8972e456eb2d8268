package com.example.JobCopilot.model;

/** Result of fetching the configured JWKS URL for diagnostics. */
public record JwksProbe(String jwksUrl, int status, String contentType, String bodySnippet) {
}
