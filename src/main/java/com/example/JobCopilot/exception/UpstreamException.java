package com.example.JobCopilot.exception;

import org.springframework.http.HttpStatus;

/**
 * A model provider, embedding or vector backend call failed. The message is generic;
 * provider response bodies stay in the cause and the logs.
 */
public class UpstreamException extends CopilotException {

    public UpstreamException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }
}
