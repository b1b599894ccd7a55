package com.campusagent.backend.controller;

import com.campusagent.backend.dto.ScoredEntryResponse;
import com.campusagent.backend.dto.SearchRequest;
import com.campusagent.backend.dto.SearchResponse;
import com.campusagent.backend.dto.SearchStatusResponse;
import com.campusagent.backend.model.ScoredEntry;
import com.campusagent.backend.service.CatalogService;
import com.campusagent.backend.service.QueryOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Diagnostics for the similarity search, bypassing intent classification.
 */
@RestController
@RequestMapping("/api/search")
@Tag(name = "Search", description = "Direct catalog search and index status")
public class SearchController {

    private static final Logger log = LoggerFactory.getLogger(SearchController.class);

    private final QueryOrchestrator queryOrchestrator;
    private final CatalogService catalogService;
    private final int defaultLimit;

    public SearchController(QueryOrchestrator queryOrchestrator,
            CatalogService catalogService,
            @Value("${search.default-limit:3}") int defaultLimit) {
        this.queryOrchestrator = queryOrchestrator;
        this.catalogService = catalogService;
        this.defaultLimit = defaultLimit;
    }

    @PostMapping
    @Operation(summary = "Search catalog", description = "Vectorize the query and return the closest catalog entries")
    public ResponseEntity<SearchResponse> search(@Valid @RequestBody SearchRequest request) {
        int limit = request.getLimit() != null ? request.getLimit() : defaultLimit;
        List<ScoredEntry> results = queryOrchestrator.search(request.getQuery(), limit, request.getScoreThreshold());

        return ResponseEntity.ok(SearchResponse.builder()
                .query(request.getQuery())
                .results(results.stream().map(ScoredEntryResponse::from).collect(Collectors.toList()))
                .totalResults(results.size())
                .build());
    }

    @GetMapping("/status")
    @Operation(summary = "Search status", description = "Catalog size and embedding coverage")
    public ResponseEntity<SearchStatusResponse> status() {
        try {
            return ResponseEntity.ok(catalogService.status());
        } catch (RuntimeException e) {
            log.error("Failed to read catalog status: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(SearchStatusResponse.builder()
                            .databaseConnected(false)
                            .message("Catalog database is unavailable: " + e.getMessage())
                            .build());
        }
    }
}
