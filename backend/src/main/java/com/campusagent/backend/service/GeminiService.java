package com.campusagent.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Client for the Gemini generateContent endpoint.
 * Every call is a single blocking request; there are no retries.
 */
@Service
public class GeminiService {

    private static final Logger log = LoggerFactory.getLogger(GeminiService.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiUrl;
    private final String apiKey;
    private final String model;
    private final Duration timeout;

    public GeminiService(ObjectMapper objectMapper,
            @Value("${gemini.api.url}") String apiUrl,
            @Value("${gemini.api.key:}") String apiKey,
            @Value("${gemini.api.model}") String model,
            @Value("${gemini.api.timeout-seconds:30}") long timeoutSeconds) {
        this.timeout = Duration.ofSeconds(timeoutSeconds);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = objectMapper;
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
        this.model = model;
    }

    /**
     * Generate text from an ordered list of prompt segments.
     *
     * @return the first text part of the first candidate
     * @throws GenerativeBackendException when the call fails or yields no text
     */
    public String generateContent(List<String> segments, int maxOutputTokens, double temperature) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new GenerativeBackendException(GenerativeBackendException.Reason.UNAVAILABLE,
                    "Gemini API key is not configured");
        }

        Map<String, Object> requestBody = Map.of(
                "contents", List.of(Map.of(
                        "parts", segments.stream()
                                .map(segment -> Map.of("text", segment))
                                .collect(Collectors.toList()))),
                "generationConfig", Map.of(
                        "temperature", temperature,
                        "maxOutputTokens", maxOutputTokens));

        String jsonBody;
        try {
            jsonBody = objectMapper.writeValueAsString(requestBody);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize Gemini request", e);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(endpoint()))
                .timeout(timeout)
                .header("Accept", "application/json")
                .header("Content-Type", "application/json")
                .header("x-goog-api-key", apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                .build();

        log.debug("Sending generateContent request to Gemini model {} with {} segments", model, segments.size());

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new GenerativeBackendException(GenerativeBackendException.Reason.UNAVAILABLE,
                    "Gemini API call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerativeBackendException(GenerativeBackendException.Reason.UNAVAILABLE,
                    "Gemini API call was interrupted", e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            log.error("Gemini API error: {} - {}", response.statusCode(), response.body());
            throw new GenerativeBackendException(GenerativeBackendException.Reason.UNAVAILABLE,
                    "Gemini API call failed with status " + response.statusCode());
        }

        return extractText(response.body());
    }

    String endpoint() {
        String base = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        return base + "/" + model + ":generateContent";
    }

    /**
     * Pull the first candidate's first text part out of a response body.
     */
    String extractText(String body) {
        JsonNode responseJson;
        try {
            responseJson = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new GenerativeBackendException(GenerativeBackendException.Reason.MALFORMED_RESPONSE,
                    "Gemini API returned a body that is not JSON", e);
        }

        JsonNode text = responseJson
                .path("candidates")
                .path(0)
                .path("content")
                .path("parts")
                .path(0)
                .path("text");

        if (!text.isTextual()) {
            throw new GenerativeBackendException(GenerativeBackendException.Reason.EMPTY_RESULT,
                    "No valid response received from Gemini API");
        }
        return text.asText();
    }
}
