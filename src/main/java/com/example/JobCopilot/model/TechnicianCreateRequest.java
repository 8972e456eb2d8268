package com.example.JobCopilot.model;

public record TechnicianCreateRequest(
        String email,
        String firstName,
        String lastName,
        String role,
        String phone
) {
}
