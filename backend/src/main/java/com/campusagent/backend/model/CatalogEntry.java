package com.campusagent.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A searchable resource in the catalog.
 * The embedding is computed from {@link #compositeText()} at ingestion and
 * refreshed whenever the title, description or category change.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "resources")
public class CatalogEntry {

    @Id
    private String id;

    private String title;

    private String description;

    @Indexed
    private String category;

    private String url;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    /**
     * Unit-length vector (384-dim) used by the Atlas vector index and the local scan.
     */
    private List<Double> embedding;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;

    /**
     * Text that gets embedded for this entry.
     */
    public String compositeText() {
        return String.join(" ",
                title != null ? title : "",
                description != null ? description : "",
                category != null ? category : "").trim();
    }

    public boolean hasEmbedding() {
        return embedding != null && !embedding.isEmpty();
    }
}
