package com.example.JobCopilot.model;

public record JobAssignRequest(String technicianId) {
}
