package com.example.JobCopilot.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends CopilotException {

    public NotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }
}
