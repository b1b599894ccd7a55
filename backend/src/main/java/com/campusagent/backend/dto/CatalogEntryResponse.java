package com.campusagent.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for catalog entries. The embedding is summarized, not returned.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogEntryResponse {

    private String id;
    private String title;
    private String description;
    private String category;
    private String url;
    private List<String> tags;
    private int embeddingDimensions;
    private Instant createdAt;
    private Instant updatedAt;
}
