package com.example.JobCopilot.exception;

import org.springframework.http.HttpStatus;

/**
 * Base type for failures that map onto an HTTP status with a client-safe message.
 */
public abstract class CopilotException extends RuntimeException {

    private final HttpStatus status;

    protected CopilotException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    protected CopilotException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
