package com.example.JobCopilot.service;

import com.example.JobCopilot.model.ParsedResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads the model's reply into answer, citations and follow-ups. Never throws:
 * anything that is not a JSON object becomes a plain-text answer.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResponseParser {

    private static final TypeReference<Map<String, Object>> CITATION = new TypeReference<>() { };

    private static final Pattern OPENING_FENCE = Pattern.compile("^```(?:json)?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern CLOSING_FENCE = Pattern.compile("\\s*```\\s*$");

    private final ObjectMapper objectMapper;

    public ParsedResponse parse(String raw) {
        String trimmed = raw == null ? "" : raw.trim();
        String payload = stripFence(trimmed);

        JsonNode root;
        try {
            // The whole payload must be one JSON value; trailing prose makes it plain text
            root = objectMapper.reader()
                    .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("Model output is not JSON, returning it as plain text");
            return ParsedResponse.plainText(trimmed);
        }
        if (root == null || !root.isObject()) {
            return ParsedResponse.plainText(trimmed);
        }

        JsonNode answer = root.get("answer");
        return new ParsedResponse(
                answer != null && answer.isTextual() ? answer.textValue() : "",
                citations(root.get("citations")),
                followUps(root.has("follow_ups") ? root.get("follow_ups") : root.get("followUps")));
    }

    static String stripFence(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        String withoutOpening = OPENING_FENCE.matcher(text).replaceFirst("");
        return CLOSING_FENCE.matcher(withoutOpening).replaceFirst("").trim();
    }

    private List<Map<String, Object>> citations(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<Map<String, Object>> citations = new ArrayList<>();
        for (JsonNode element : node) {
            if (element.isObject()) {
                citations.add(objectMapper.convertValue(element, CITATION));
            } else {
                // Bare references such as "note_1" name the cited document
                citations.add(Collections.singletonMap("doc_id", objectMapper.convertValue(element, Object.class)));
            }
        }
        return citations;
    }

    private static List<String> followUps(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> followUps = new ArrayList<>();
        for (JsonNode element : node) {
            if (element.isTextual()) {
                followUps.add(element.textValue());
            }
        }
        return followUps;
    }
}
