package com.campusagent.backend.service;

import com.campusagent.backend.model.Intent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Asks Gemini whether a question needs a catalog search or is casual chat.
 */
@Service
public class IntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(IntentClassifier.class);

    static final String SYSTEM_INSTRUCTION =
            "You are a university campus agent that helps students, faculty, and staff find educational "
                    + "resources and information. You have access to a database of university resources.\n\n"
                    + "When the user wants to search for resources, courses, departments, services, facilities, "
                    + "or anything else related to the university, reply with a JSON object in exactly this format:\n"
                    + "{\"isSearching\": true, \"searchQuery\": \"...\", \"userMessage\": \"...\"}\n\n"
                    + "When the user is just casually talking or asking a general question, reply with:\n"
                    + "{\"isSearching\": false, \"userMessage\": \"...\"}\n\n"
                    + "\"searchQuery\" is a short phrase describing the resources to look up. "
                    + "\"userMessage\" is your response to the user. Keep it helpful, educational and focused "
                    + "on the university. If the user is searching, say that you will help them find the "
                    + "relevant information.\n\n"
                    + "Do not include any other text outside the JSON object.";

    private final GeminiService geminiService;
    private final IntentParser intentParser;

    public IntentClassifier(GeminiService geminiService, IntentParser intentParser) {
        this.geminiService = geminiService;
        this.intentParser = intentParser;
    }

    /**
     * Classify a user question.
     *
     * @throws GenerativeBackendException if Gemini cannot be reached or returns no text
     */
    public Intent classify(String userText) {
        log.info("Classifying query: {}", userText);

        String reply = geminiService.generateContent(
                List.of(SYSTEM_INSTRUCTION, "User query: " + userText), 1024, 0.4);

        Intent intent = intentParser.parse(reply);
        log.info("Query classified as {}", intent.kind());
        return intent;
    }
}
