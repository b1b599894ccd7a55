package com.campusagent.backend.service;

import com.campusagent.backend.model.CatalogEntry;
import com.campusagent.backend.model.ScoredEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the final answer for a search from the classifier's draft message
 * and the ranked entries. Gemini writes the prose when it can; otherwise the
 * entries are listed with a fixed template in the same order.
 */
@Service
public class ResultSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(ResultSynthesizer.class);

    public static final String NO_RESULTS_NOTICE = "\n\nI couldn't find any specific resources for your search. "
            + "Please try different keywords or ask me something else!";

    static final String RESULTS_HEADER = "\n\nHere are the best resources I found:\n\n";

    private static final String SYNTHESIS_INSTRUCTION =
            "You are a helpful university assistant. Using only the resources listed below, write a concise, "
                    + "conversational answer to the user's question. Reference the most relevant resources with "
                    + "clickable markdown links in the form [Title](URL), most relevant first. "
                    + "If the resources do not fully answer the question, say so briefly.";

    private final GeminiService geminiService;

    public ResultSynthesizer(GeminiService geminiService) {
        this.geminiService = geminiService;
    }

    public String synthesize(String draftMessage, List<ScoredEntry> entries) {
        return synthesize(null, draftMessage, entries);
    }

    /**
     * @param question the user's original question, used as context for the summary
     */
    public String synthesize(String question, String draftMessage, List<ScoredEntry> entries) {
        String draft = draftMessage != null ? draftMessage : "";
        if (entries == null || entries.isEmpty()) {
            return draft + NO_RESULTS_NOTICE;
        }

        try {
            String answer = geminiService.generateContent(
                    buildPrompt(question, draft, entries), 1024, 0.5);
            if (answer != null && !answer.isBlank()) {
                return answer.trim();
            }
            log.warn("Gemini returned a blank summary, using template answer");
        } catch (RuntimeException e) {
            log.warn("Summary generation failed, using template answer: {}", e.getMessage());
        }
        return templateAnswer(draft, entries);
    }

    List<String> buildPrompt(String question, String draft, List<ScoredEntry> entries) {
        StringBuilder resources = new StringBuilder("Resources:\n");
        for (int i = 0; i < entries.size(); i++) {
            CatalogEntry entry = entries.get(i).entry();
            resources.append(i + 1).append(". Title: ").append(nullToEmpty(entry.getTitle())).append('\n')
                    .append("   Description: ").append(nullToEmpty(entry.getDescription())).append('\n')
                    .append("   Category: ").append(nullToEmpty(entry.getCategory())).append('\n')
                    .append("   URL: ").append(nullToEmpty(entry.getUrl())).append('\n')
                    .append("   Relevance: ")
                    .append(String.format(Locale.ROOT, "%.3f", entries.get(i).score())).append('\n');
        }

        List<String> segments = new ArrayList<>();
        segments.add(SYNTHESIS_INSTRUCTION);
        if (question != null && !question.isBlank()) {
            segments.add("User question: " + question);
        }
        segments.add("Your earlier reply to the user: " + draft);
        segments.add(resources.toString());
        return segments;
    }

    static String templateAnswer(String draft, List<ScoredEntry> entries) {
        List<String> items = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            CatalogEntry entry = entries.get(i).entry();
            items.add((i + 1) + ". [" + nullToEmpty(entry.getTitle()) + "](" + nullToEmpty(entry.getUrl()) + ")\n"
                    + nullToEmpty(entry.getDescription()));
        }
        return draft + RESULTS_HEADER + String.join("\n\n", items);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
