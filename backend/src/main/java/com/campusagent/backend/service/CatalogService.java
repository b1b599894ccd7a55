package com.campusagent.backend.service;

import com.campusagent.backend.dto.CatalogEntryRequest;
import com.campusagent.backend.dto.CatalogEntryResponse;
import com.campusagent.backend.dto.ImportResourceItem;
import com.campusagent.backend.dto.ImportSummary;
import com.campusagent.backend.dto.SearchStatusResponse;
import com.campusagent.backend.model.CatalogEntry;
import com.campusagent.backend.repository.CatalogEntryRepository;
import com.campusagent.backend.util.VectorMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Service for managing catalog entries and their embeddings.
 */
@Service
public class CatalogService {

    private static final Logger log = LoggerFactory.getLogger(CatalogService.class);

    private static final int MAX_TITLE_TAGS = 5;
    private static final int MIN_TAG_LENGTH = 4;

    private final CatalogEntryRepository catalogEntryRepository;
    private final TextVectorizer textVectorizer;
    private final String indexName;

    public CatalogService(CatalogEntryRepository catalogEntryRepository,
            TextVectorizer textVectorizer,
            @Value("${search.vector.index-name:vector_index}") String indexName) {
        this.catalogEntryRepository = catalogEntryRepository;
        this.textVectorizer = textVectorizer;
        this.indexName = indexName;
    }

    /**
     * Store a new entry with a freshly computed embedding.
     */
    public CatalogEntry create(CatalogEntryRequest request) {
        CatalogEntry entry = CatalogEntry.builder()
                .title(request.getTitle().trim())
                .description(trimOrEmpty(request.getDescription()))
                .category(trimOrEmpty(request.getCategory()))
                .url(request.getUrl().trim())
                .tags(request.getTags() != null ? new ArrayList<>(request.getTags()) : new ArrayList<>())
                .build();
        entry.setEmbedding(VectorMath.toList(textVectorizer.embed(entry.compositeText())));

        entry = catalogEntryRepository.save(entry);
        log.debug("Stored catalog entry: {} ({})", entry.getId(), entry.getTitle());
        return entry;
    }

    public Optional<CatalogEntry> findById(String id) {
        return catalogEntryRepository.findById(id);
    }

    public Page<CatalogEntry> list(String category, Pageable pageable) {
        if (category != null && !category.isBlank()) {
            return catalogEntryRepository.findByCategory(category, pageable);
        }
        return catalogEntryRepository.findAll(pageable);
    }

    /**
     * Update an entry. The embedding is recomputed only when the embedded text changes.
     */
    public Optional<CatalogEntry> update(String id, CatalogEntryRequest request) {
        return catalogEntryRepository.findById(id).map(entry -> {
            String previousText = entry.compositeText();

            entry.setTitle(request.getTitle().trim());
            entry.setDescription(trimOrEmpty(request.getDescription()));
            entry.setCategory(trimOrEmpty(request.getCategory()));
            entry.setUrl(request.getUrl().trim());
            if (request.getTags() != null) {
                entry.setTags(new ArrayList<>(request.getTags()));
            }

            if (!entry.hasEmbedding() || !Objects.equals(previousText, entry.compositeText())) {
                log.debug("Content of entry {} changed, re-embedding", id);
                entry.setEmbedding(VectorMath.toList(textVectorizer.embed(entry.compositeText())));
            }
            return catalogEntryRepository.save(entry);
        });
    }

    public boolean delete(String id) {
        if (!catalogEntryRepository.existsById(id)) {
            return false;
        }
        catalogEntryRepository.deleteById(id);
        return true;
    }

    /**
     * Remove every entry from the catalog.
     *
     * @return number of entries removed
     */
    public long clear() {
        long count = catalogEntryRepository.count();
        catalogEntryRepository.deleteAll();
        log.info("Cleared {} catalog entries", count);
        return count;
    }

    /**
     * Recompute the embedding of every entry.
     *
     * @return number of entries re-embedded
     */
    public int reembedAll() {
        List<CatalogEntry> entries = catalogEntryRepository.findAll();
        for (CatalogEntry entry : entries) {
            entry.setEmbedding(VectorMath.toList(textVectorizer.embed(entry.compositeText())));
        }
        catalogEntryRepository.saveAll(entries);
        log.info("Re-embedded {} catalog entries", entries.size());
        return entries.size();
    }

    /**
     * Import resources grouped by category name. Entries without a title or URL
     * are counted as failed and skipped.
     */
    public ImportSummary importCategorized(Map<String, List<ImportResourceItem>> resourcesByCategory) {
        ImportSummary summary = ImportSummary.builder().build();

        resourcesByCategory.forEach((rawCategory, items) -> {
            if (items == null) {
                return;
            }
            String category = rawCategory.trim();
            summary.setTotalCategories(summary.getTotalCategories() + 1);
            ImportSummary.CategoryResult categoryResult = ImportSummary.CategoryResult.builder()
                    .category(category)
                    .build();

            for (ImportResourceItem item : items) {
                if (item == null) {
                    continue;
                }
                summary.setTotalProcessed(summary.getTotalProcessed() + 1);
                categoryResult.setProcessed(categoryResult.getProcessed() + 1);

                String title = trimOrEmpty(item.getTitle());
                String url = trimOrEmpty(item.getUrl());
                if (title.isEmpty() || url.isEmpty()) {
                    summary.setFailed(summary.getFailed() + 1);
                    categoryResult.setFailed(categoryResult.getFailed() + 1);
                    categoryResult.getErrors().add("Missing required fields: " + abbreviate(title));
                    continue;
                }

                try {
                    create(CatalogEntryRequest.builder()
                            .title(title)
                            .description(trimOrEmpty(item.getText()))
                            .url(url)
                            .category(category)
                            .tags(deriveTags(category, title))
                            .build());
                    summary.setSuccessful(summary.getSuccessful() + 1);
                    categoryResult.setSuccessful(categoryResult.getSuccessful() + 1);
                } catch (RuntimeException e) {
                    log.warn("Failed to import resource '{}': {}", title, e.getMessage());
                    summary.setFailed(summary.getFailed() + 1);
                    categoryResult.setFailed(categoryResult.getFailed() + 1);
                    categoryResult.getErrors().add("Error processing " + abbreviate(title) + ": " + e.getMessage());
                }
            }

            summary.getDetails().add(categoryResult);
        });

        log.info("Imported {} of {} resources across {} categories",
                summary.getSuccessful(), summary.getTotalProcessed(), summary.getTotalCategories());
        return summary;
    }

    /**
     * Report whether the catalog is ready for vector search.
     */
    public SearchStatusResponse status() {
        long total = catalogEntryRepository.count();
        long withEmbeddings = catalogEntryRepository.countWithEmbedding();

        String message;
        if (total == 0) {
            message = "No documents found in database. Please upload some resources first.";
        } else if (withEmbeddings == 0) {
            message = "No documents with embeddings found. Vector search requires documents to have an 'embedding' field.";
        } else {
            message = "Database is ready for vector search.";
        }

        return SearchStatusResponse.builder()
                .databaseConnected(true)
                .totalDocuments(total)
                .documentsWithEmbeddings(withEmbeddings)
                .indexName(indexName)
                .message(message)
                .build();
    }

    static List<String> deriveTags(String category, String title) {
        List<String> tags = new ArrayList<>();
        tags.add(category.toLowerCase(Locale.ROOT));
        List<String> titleWords = List.of(title.split("\\s+")).stream()
                .filter(word -> word.length() >= MIN_TAG_LENGTH)
                .map(word -> word.toLowerCase(Locale.ROOT))
                .limit(MAX_TITLE_TAGS)
                .collect(Collectors.toList());
        tags.addAll(titleWords);
        return tags;
    }

    /**
     * Convert entry to response DTO.
     */
    public CatalogEntryResponse toResponse(CatalogEntry entry) {
        return CatalogEntryResponse.builder()
                .id(entry.getId())
                .title(entry.getTitle())
                .description(entry.getDescription())
                .category(entry.getCategory())
                .url(entry.getUrl())
                .tags(entry.getTags())
                .embeddingDimensions(entry.hasEmbedding() ? entry.getEmbedding().size() : 0)
                .createdAt(entry.getCreatedAt())
                .updatedAt(entry.getUpdatedAt())
                .build();
    }

    private static String trimOrEmpty(String value) {
        return value != null ? value.trim() : "";
    }

    private static String abbreviate(String value) {
        return value.length() > 50 ? value.substring(0, 50) + "..." : value;
    }
}
