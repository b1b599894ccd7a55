package com.campusagent.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Readiness of the catalog for vector search.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchStatusResponse {

    private boolean databaseConnected;
    private long totalDocuments;
    private long documentsWithEmbeddings;
    private String indexName;
    private String message;
}
