package com.example.JobCopilot.exception;

public class JobNotFoundException extends NotFoundException {

    private final String tenantId;
    private final String jobId;

    public JobNotFoundException(String tenantId, String jobId) {
        super("Job not found");
        this.tenantId = tenantId;
        this.jobId = jobId;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getJobId() {
        return jobId;
    }
}
