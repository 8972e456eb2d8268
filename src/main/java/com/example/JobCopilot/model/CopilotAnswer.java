package com.example.JobCopilot.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CopilotAnswer(
        String answer,
        List<Map<String, Object>> citations,
        @JsonProperty("follow_ups") List<String> followUps,
        ChatDebug debug
) {
}
