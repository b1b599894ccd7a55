package com.campusagent.backend.service;

import com.campusagent.backend.model.ScoredEntry;

import java.util.List;

/**
 * Finds the catalog entries closest to a query vector.
 */
public interface SimilarityIndex {

    /**
     * @return at most {@code limit} entries, best score first
     */
    List<ScoredEntry> search(double[] queryVector, int limit);
}
