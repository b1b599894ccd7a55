package com.campusagent.backend.service;

import com.campusagent.backend.model.Intent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns the classifier's raw reply into an {@link Intent}.
 * <p>
 * A reply that is not a JSON object becomes casual chat carrying the raw text,
 * so parsing never fails.
 */
@Component
public class IntentParser {

    private static final Logger log = LoggerFactory.getLogger(IntentParser.class);

    private final ObjectMapper objectMapper;

    public IntentParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Intent parse(String rawReply) {
        String raw = rawReply != null ? rawReply : "";
        String cleaned = stripCodeFences(raw);

        JsonNode root;
        try {
            root = objectMapper.readTree(cleaned);
        } catch (JsonProcessingException e) {
            log.warn("Classifier reply is not JSON, returning it as plain text");
            return new Intent.CasualChat(raw);
        }

        if (root == null || !root.isObject()) {
            log.warn("Classifier reply is not a JSON object, returning it as plain text");
            return new Intent.CasualChat(raw);
        }

        if (root.path("isSearching").asBoolean(false)) {
            return new Intent.Search(
                    root.path("searchQuery").asText(""),
                    root.path("userMessage").asText(""));
        }

        JsonNode userMessage = root.get("userMessage");
        return new Intent.CasualChat(userMessage != null && !userMessage.isNull()
                ? userMessage.asText()
                : raw);
    }

    static String stripCodeFences(String text) {
        return text
                .replace("```json", "")
                .replace("```", "")
                .trim();
    }
}
