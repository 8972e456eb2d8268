package com.example.JobCopilot.security;

/**
 * Caller scope for one request. {@code userId} and {@code role} are set only when the request
 * carried a verified access token.
 */
public record TenantContext(String tenantId, String userId, String role) {

    public static final String ATTRIBUTE = TenantContext.class.getName();

    public static TenantContext of(String tenantId) {
        return new TenantContext(tenantId, null, null);
    }
}
