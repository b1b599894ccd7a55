package com.campusagent.backend.service;

import com.campusagent.backend.model.ScoredEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Tries the primary index and falls back to a second one when the primary
 * throws or comes back empty. Primary failures are logged, never rethrown.
 */
public class FallbackSimilarityIndex implements SimilarityIndex {

    private static final Logger log = LoggerFactory.getLogger(FallbackSimilarityIndex.class);

    private final SimilarityIndex primary;
    private final SimilarityIndex fallback;

    public FallbackSimilarityIndex(SimilarityIndex primary, SimilarityIndex fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    @Override
    public List<ScoredEntry> search(double[] queryVector, int limit) {
        return tryPrimary(queryVector, limit)
                .orElseGet(() -> runFallback(queryVector, limit));
    }

    private Optional<List<ScoredEntry>> tryPrimary(double[] queryVector, int limit) {
        try {
            List<ScoredEntry> results = primary.search(queryVector, limit);
            if (results == null || results.isEmpty()) {
                log.warn("Vector search returned no results, falling back to catalog scan");
                return Optional.empty();
            }
            return Optional.of(results);
        } catch (RuntimeException e) {
            log.warn("Vector search failed, falling back to catalog scan: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private List<ScoredEntry> runFallback(double[] queryVector, int limit) {
        try {
            return fallback.search(queryVector, limit);
        } catch (RuntimeException e) {
            log.error("Fallback search failed: {}", e.getMessage());
            return List.of();
        }
    }
}
