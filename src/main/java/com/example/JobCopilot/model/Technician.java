package com.example.JobCopilot.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

public record Technician(
        String id,
        String firstName,
        String lastName,
        String email,
        String role,
        String phone,
        Instant createdAt
) {

    /** "First Last", falling back to the email when no name is stored. */
    @JsonIgnore
    public String displayName() {
        String first = firstName == null ? "" : firstName.trim();
        String last = lastName == null ? "" : lastName.trim();
        String name = (first + " " + last).trim();
        return name.isEmpty() ? email : name;
    }
}
