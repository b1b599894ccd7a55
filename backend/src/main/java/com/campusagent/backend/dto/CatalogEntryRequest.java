package com.campusagent.backend.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for creating or updating a catalog entry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogEntryRequest {

    @NotBlank
    private String title;

    private String description;

    private String category;

    @NotBlank
    private String url;

    private List<String> tags;
}
