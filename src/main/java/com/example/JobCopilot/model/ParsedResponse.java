package com.example.JobCopilot.model;

import java.util.List;
import java.util.Map;

public record ParsedResponse(String answer, List<Map<String, Object>> citations, List<String> followUps) {

    public static ParsedResponse plainText(String text) {
        return new ParsedResponse(text, List.of(), List.of());
    }
}
