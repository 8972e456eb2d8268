package com.example.JobCopilot.exception;

public class MissingTenantException extends ValidationException {

    public MissingTenantException() {
        super("Missing x-tenant-id header");
    }
}
