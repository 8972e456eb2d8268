package com.example.JobCopilot.model;

import java.util.List;
import java.util.Map;

/**
 * Diagnostics attached to a chat answer when the caller sends {@code x-debug: 1}.
 */
public record ChatDebug(
        boolean vectorEnabled,
        int vectorMatches,
        int evidenceCount,
        Map<String, Object> vectorFilter,
        Map<String, Object> vectorFilterUsed,
        List<VectorDiagnostics.FilterError> vectorFilterErrors,
        List<VectorMatch> unfilteredMatches,
        List<VectorRecord> vectorMetadata,
        boolean vectorFilterFallbackUsed
) {
}
