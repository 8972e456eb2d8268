package com.example.JobCopilot.service;

import java.util.Map;

/**
 * Versioned system prompts. Audit rows record the version used for each answer.
 */
public final class PromptTemplates {

    public static final String DEFAULT_VERSION = "copilot.v1";

    private static final Map<String, String> SYSTEM_PROMPTS = Map.of(
            DEFAULT_VERSION, String.join(" ",
                    "You are HVACOps Copilot helping a technician on a specific job.",
                    "Only answer using the provided structured context.",
                    "If evidence is provided, you MUST use it and cite it.",
                    "If you do not see evidence, say you do not see it in the job history.",
                    "Be concise and field-oriented.",
                    "Citations must reference the provided evidence with doc_id, date, type, snippet.",
                    "Return ONLY raw JSON with keys: answer, citations, follow_ups."));

    private PromptTemplates() {
    }

    /** Unknown versions get the default prompt. */
    public static String systemPrompt(String version) {
        return SYSTEM_PROMPTS.get(resolveVersion(version));
    }

    public static String resolveVersion(String version) {
        return version != null && SYSTEM_PROMPTS.containsKey(version) ? version : DEFAULT_VERSION;
    }
}
