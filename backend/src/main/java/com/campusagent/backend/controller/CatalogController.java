package com.campusagent.backend.controller;

import com.campusagent.backend.dto.CatalogEntryRequest;
import com.campusagent.backend.dto.CatalogEntryResponse;
import com.campusagent.backend.dto.ImportResourceItem;
import com.campusagent.backend.dto.ImportSummary;
import com.campusagent.backend.model.CatalogEntry;
import com.campusagent.backend.service.CatalogService;
import io.swagger.v3.oas.annotations.Hidden;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Controller for catalog administration.
 * Public CRUD under /api/resources, destructive bulk operations under /admin/resources.
 */
@RestController
@Tag(name = "Resources", description = "Catalog entry management")
public class CatalogController {

    private final CatalogService catalogService;

    public CatalogController(CatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @PostMapping("/api/resources")
    @Operation(summary = "Create resource", description = "Store a resource with an auto-generated embedding")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Resource created"),
            @ApiResponse(responseCode = "400", description = "Missing title or URL")
    })
    public ResponseEntity<CatalogEntryResponse> create(@Valid @RequestBody CatalogEntryRequest request) {
        CatalogEntry entry = catalogService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(catalogService.toResponse(entry));
    }

    @GetMapping("/api/resources")
    @Operation(summary = "List resources", description = "Paginated list, optionally filtered by category")
    public ResponseEntity<Page<CatalogEntryResponse>> list(
            @RequestParam(required = false) String category,
            Pageable pageable) {
        return ResponseEntity.ok(catalogService.list(category, pageable).map(catalogService::toResponse));
    }

    @GetMapping("/api/resources/{id}")
    @Operation(summary = "Get resource")
    public ResponseEntity<CatalogEntryResponse> get(@Parameter(description = "Resource ID") @PathVariable String id) {
        return catalogService.findById(id)
                .map(entry -> ResponseEntity.ok(catalogService.toResponse(entry)))
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/api/resources/{id}")
    @Operation(summary = "Update resource", description = "Update a resource, re-embedding it if its text changed")
    public ResponseEntity<CatalogEntryResponse> update(
            @Parameter(description = "Resource ID") @PathVariable String id,
            @Valid @RequestBody CatalogEntryRequest request) {
        return catalogService.update(id, request)
                .map(entry -> ResponseEntity.ok(catalogService.toResponse(entry)))
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/api/resources/{id}")
    @Operation(summary = "Delete resource")
    public ResponseEntity<Void> delete(@Parameter(description = "Resource ID") @PathVariable String id) {
        return catalogService.delete(id)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @PostMapping("/api/resources/import")
    @Operation(summary = "Import resources", description = "Import resources grouped by category: {category: [{title, text, url}]}")
    public ResponseEntity<ImportSummary> importResources(
            @RequestBody Map<String, List<ImportResourceItem>> resourcesByCategory) {
        if (resourcesByCategory == null || resourcesByCategory.isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(catalogService.importCategorized(resourcesByCategory));
    }

    // ==================== Admin Endpoints ====================

    @PostMapping("/admin/resources/reembed")
    @Operation(summary = "Re-embed catalog", description = "Recompute the embedding of every resource")
    @Hidden
    public ResponseEntity<Map<String, Object>> reembed() {
        int count = catalogService.reembedAll();
        return ResponseEntity.ok(Map.of(
                "reembedded", count,
                "message", "Re-embedded " + count + " resources"));
    }

    @DeleteMapping("/admin/resources")
    @Operation(summary = "Clear catalog", description = "Delete every resource")
    @Hidden
    public ResponseEntity<Map<String, Object>> clear() {
        long count = catalogService.clear();
        return ResponseEntity.ok(Map.of(
                "deleted", count,
                "message", "Successfully cleared " + count + " resources"));
    }
}
