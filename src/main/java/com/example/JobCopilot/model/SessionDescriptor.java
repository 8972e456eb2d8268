package com.example.JobCopilot.model;

public record SessionDescriptor(String sessionId, String jobId, String tenantId, String status) {

    public static String sessionIdFor(String jobId) {
        return "session_" + jobId;
    }

    public static SessionDescriptor active(String tenantId, String jobId) {
        return new SessionDescriptor(sessionIdFor(jobId), jobId, tenantId, "active");
    }
}
