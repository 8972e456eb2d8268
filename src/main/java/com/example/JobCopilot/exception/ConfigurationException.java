package com.example.JobCopilot.exception;

import org.springframework.http.HttpStatus;

/** Required deployment configuration (credentials, index binding) is absent. */
public class ConfigurationException extends CopilotException {

    public ConfigurationException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message);
    }
}
