package com.example.JobCopilot.model;

import java.util.List;

public record VectorRetrievalResult(List<EvidenceItem> evidence, VectorDiagnostics diagnostics) {

    public static VectorRetrievalResult disabled() {
        return new VectorRetrievalResult(List.of(), VectorDiagnostics.disabled());
    }
}
