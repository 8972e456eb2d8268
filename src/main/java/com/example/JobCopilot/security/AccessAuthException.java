package com.example.JobCopilot.security;

import com.example.JobCopilot.exception.CopilotException;
import org.springframework.http.HttpStatus;

/**
 * Access gateway rejection: 401 for a missing or invalid token, 403 for an identity that is
 * not mapped or belongs to another tenant, 500 when verification is not configured.
 */
public class AccessAuthException extends CopilotException {

    public AccessAuthException(HttpStatus status, String message) {
        super(status, message);
    }

    public AccessAuthException(HttpStatus status, String message, Throwable cause) {
        super(status, message, cause);
    }

    public static AccessAuthException unauthorized(String message) {
        return new AccessAuthException(HttpStatus.UNAUTHORIZED, message);
    }

    public static AccessAuthException forbidden(String message) {
        return new AccessAuthException(HttpStatus.FORBIDDEN, message);
    }

    public static AccessAuthException notConfigured() {
        return new AccessAuthException(HttpStatus.INTERNAL_SERVER_ERROR, "Access auth is not configured");
    }
}
