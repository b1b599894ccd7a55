package com.campusagent.backend.service;

import com.campusagent.backend.model.AssistantReply;
import com.campusagent.backend.model.Intent;
import com.campusagent.backend.model.IntentKind;
import com.campusagent.backend.model.ScoredEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs one question through classify, then (for searches) vectorize, search
 * and synthesize. Only a classification failure escapes; the later stages
 * handle their own failures.
 */
@Service
public class QueryOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(QueryOrchestrator.class);

    private final IntentClassifier intentClassifier;
    private final TextVectorizer textVectorizer;
    private final SimilarityIndex similarityIndex;
    private final ResultSynthesizer resultSynthesizer;
    private final int resultLimit;

    public QueryOrchestrator(IntentClassifier intentClassifier,
            TextVectorizer textVectorizer,
            SimilarityIndex similarityIndex,
            ResultSynthesizer resultSynthesizer,
            @Value("${search.default-limit:3}") int resultLimit) {
        this.intentClassifier = intentClassifier;
        this.textVectorizer = textVectorizer;
        this.similarityIndex = similarityIndex;
        this.resultSynthesizer = resultSynthesizer;
        this.resultLimit = resultLimit;
    }

    /**
     * Answer a user question.
     *
     * @throws GenerativeBackendException if the question could not be classified
     */
    public AssistantReply answer(String userText) {
        Intent intent = intentClassifier.classify(userText);

        if (intent instanceof Intent.Search search) {
            String phrase = search.searchPhrase().isBlank() ? userText : search.searchPhrase();
            log.info("Searching catalog for: {}", phrase);

            double[] queryVector = textVectorizer.embed(phrase);
            List<ScoredEntry> entries = similarityIndex.search(queryVector, resultLimit);
            log.info("Found {} resources for: {}", entries.size(), phrase);

            String text = resultSynthesizer.synthesize(userText, search.draftMessage(), entries);
            return AssistantReply.builder()
                    .text(text)
                    .intent(IntentKind.SEARCH)
                    .searchPhrase(phrase)
                    .sources(entries)
                    .build();
        }

        return AssistantReply.builder()
                .text(intent.message())
                .intent(IntentKind.CASUAL_CHAT)
                .build();
    }

    /**
     * Vectorize a phrase and query the index directly, without classification.
     *
     * @param scoreThreshold entries scoring at or below it are dropped; null keeps everything
     */
    public List<ScoredEntry> search(String phrase, int limit, Double scoreThreshold) {
        if (phrase == null || phrase.isBlank()) {
            return List.of();
        }
        List<ScoredEntry> entries = similarityIndex.search(textVectorizer.embed(phrase), limit);
        if (scoreThreshold == null) {
            return entries;
        }
        return entries.stream()
                .filter(entry -> entry.score() > scoreThreshold)
                .collect(Collectors.toList());
    }
}
