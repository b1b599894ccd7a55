package com.campusagent.backend.model;

/**
 * A catalog entry with the similarity score it was ranked by.
 */
public record ScoredEntry(CatalogEntry entry, double score) {
}
