package com.campusagent.backend.service;

import com.campusagent.backend.model.CatalogEntry;
import com.campusagent.backend.model.ScoredEntry;
import com.campusagent.backend.repository.CatalogEntryRepository;
import com.campusagent.backend.util.VectorMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Exact search by scanning the whole catalog and scoring each entry with
 * cosine similarity. Never throws.
 */
@Component
public class CatalogScanIndex implements SimilarityIndex {

    private static final Logger log = LoggerFactory.getLogger(CatalogScanIndex.class);

    private final CatalogEntryRepository catalogEntryRepository;
    private final TextVectorizer textVectorizer;
    private final double minSimilarity;

    public CatalogScanIndex(CatalogEntryRepository catalogEntryRepository,
            TextVectorizer textVectorizer,
            @Value("${search.fallback.min-similarity:0.1}") double minSimilarity) {
        this.catalogEntryRepository = catalogEntryRepository;
        this.textVectorizer = textVectorizer;
        this.minSimilarity = minSimilarity;
    }

    @Override
    public List<ScoredEntry> search(double[] queryVector, int limit) {
        if (limit <= 0) {
            return List.of();
        }

        List<CatalogEntry> snapshot;
        try {
            snapshot = catalogEntryRepository.findAll();
        } catch (RuntimeException e) {
            log.error("Could not load catalog for fallback scan: {}", e.getMessage());
            return List.of();
        }

        List<ScoredEntry> candidates = new ArrayList<>();
        for (CatalogEntry entry : snapshot) {
            double similarity = VectorMath.cosineSimilarity(queryVector, embeddingOf(entry));
            if (similarity > minSimilarity) {
                candidates.add(new ScoredEntry(entry, similarity));
            }
        }

        List<ScoredEntry> results = candidates.stream()
                .sorted(Comparator.comparingDouble(ScoredEntry::score).reversed())
                .limit(limit)
                .collect(Collectors.toList());

        log.info("Fallback scan over {} entries kept {} above {}, returning {}",
                snapshot.size(), candidates.size(), minSimilarity, results.size());
        return results;
    }

    private double[] embeddingOf(CatalogEntry entry) {
        if (entry.hasEmbedding()) {
            return VectorMath.toArray(entry.getEmbedding());
        }
        return textVectorizer.embed(entry.compositeText());
    }
}
