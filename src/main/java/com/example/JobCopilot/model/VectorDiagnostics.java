package com.example.JobCopilot.model;

import java.util.List;
import java.util.Map;

public record VectorDiagnostics(
        boolean vectorEnabled,
        int vectorMatches,
        Map<String, Object> filterRequested,
        Map<String, Object> filterUsed,
        List<FilterError> filterErrors,
        boolean fallbackUsed,
        List<VectorMatch> unfilteredMatches,
        List<VectorRecord> vectorMetadata
) {

    public record FilterError(Map<String, Object> filter, String error) {
    }

    public static VectorDiagnostics disabled() {
        return new VectorDiagnostics(false, 0, null, null, List.of(), false, List.of(), List.of());
    }
}
