package com.example.JobCopilot.security;

/** Local user a verified access token maps to. */
public record AccessIdentity(String userId, String tenantId, String role, String email) {
}
