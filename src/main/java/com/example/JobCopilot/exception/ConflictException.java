package com.example.JobCopilot.exception;

import org.springframework.http.HttpStatus;

public class ConflictException extends CopilotException {

    public ConflictException(String message) {
        super(HttpStatus.CONFLICT, message);
    }
}
