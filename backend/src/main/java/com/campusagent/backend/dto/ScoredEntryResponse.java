package com.campusagent.backend.dto;

import com.campusagent.backend.model.CatalogEntry;
import com.campusagent.backend.model.ScoredEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A ranked catalog entry as returned to clients.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoredEntryResponse {

    private String id;
    private String title;
    private String description;
    private String category;
    private String url;

    /**
     * Similarity rounded to three decimals.
     */
    private double score;

    public static ScoredEntryResponse from(ScoredEntry scored) {
        CatalogEntry entry = scored.entry();
        return ScoredEntryResponse.builder()
                .id(entry.getId())
                .title(entry.getTitle())
                .description(entry.getDescription())
                .category(entry.getCategory())
                .url(entry.getUrl())
                .score(Math.round(scored.score() * 1000.0) / 1000.0)
                .build();
    }
}
