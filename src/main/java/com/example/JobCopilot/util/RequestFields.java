package com.example.JobCopilot.util;

import com.example.JobCopilot.exception.ValidationException;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Trimming helpers for loosely filled request bodies.
 */
public final class RequestFields {

    private RequestFields() {
    }

    /** Trimmed value, or a 400 "Missing {field}" when absent or blank. */
    public static String required(String value, String field) {
        String trimmed = optional(value);
        if (trimmed == null) {
            throw ValidationException.missing(field);
        }
        return trimmed;
    }

    /** Trimmed value, or null when absent or blank. */
    public static String optional(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /** ISO-8601 instant, null when absent, or a 400 "Invalid {field}". */
    public static Instant instant(String value, String field) {
        String text = optional(value);
        if (text == null) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid " + field);
        }
    }

    public static String orDefault(String value, String fallback) {
        String trimmed = optional(value);
        return trimmed == null ? fallback : trimmed;
    }
}
