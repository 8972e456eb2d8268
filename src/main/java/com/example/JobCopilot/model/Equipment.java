package com.example.JobCopilot.model;

import java.time.LocalDate;

public record Equipment(
        String id,
        String propertyId,
        String type,
        String brand,
        String model,
        String serial,
        LocalDate installedAt,
        String installedBy,
        LocalDate warrantyExpiresAt
) {
}
