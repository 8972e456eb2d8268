package com.example.JobCopilot.exception;

import org.springframework.http.HttpStatus;

public class ValidationException extends CopilotException {

    public ValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }

    public static ValidationException missing(String field) {
        return new ValidationException("Missing " + field);
    }
}
