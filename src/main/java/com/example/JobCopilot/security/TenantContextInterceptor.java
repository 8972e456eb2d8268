package com.example.JobCopilot.security;

import com.example.JobCopilot.config.CopilotProperties;
import com.example.JobCopilot.exception.MissingTenantException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Establishes the {@link TenantContext} for tenant-scoped routes.
 * <p>
 * The {@code x-tenant-id} header is always required. When access verification is enabled the
 * request must also carry a token ({@code Authorization: Bearer} or
 * {@code cf-access-jwt-assertion}) whose mapped user belongs to that tenant.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TenantContextInterceptor implements HandlerInterceptor {

    public static final String TENANT_HEADER = "x-tenant-id";
    public static final String ACCESS_ASSERTION_HEADER = "cf-access-jwt-assertion";

    private static final String BEARER_PREFIX = "Bearer ";

    private final CopilotProperties properties;
    private final AccessTokenAuthenticator authenticator;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String tenantId = request.getHeader(TENANT_HEADER);
        if (tenantId == null || tenantId.isBlank()) {
            throw new MissingTenantException();
        }
        tenantId = tenantId.trim();

        CopilotProperties.Access access = properties.getAccess();
        if (!access.isEnabled()) {
            request.setAttribute(TenantContext.ATTRIBUTE, TenantContext.of(tenantId));
            return true;
        }

        AccessIdentity identity = authenticator.authenticate(
                extractToken(request), access.getJwksUrl(), access.getIssuer(), access.getAudience());
        if (!tenantId.equals(identity.tenantId())) {
            log.warn("Tenant header {} does not match user {} of tenant {}",
                    tenantId, identity.userId(), identity.tenantId());
            throw AccessAuthException.forbidden("Tenant mismatch");
        }

        request.setAttribute(TenantContext.ATTRIBUTE,
                new TenantContext(tenantId, identity.userId(), identity.role()));
        return true;
    }

    static String extractToken(HttpServletRequest request) {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            if (!token.isEmpty()) {
                return token;
            }
        }
        String assertion = request.getHeader(ACCESS_ASSERTION_HEADER);
        return assertion == null ? null : assertion.trim();
    }
}
