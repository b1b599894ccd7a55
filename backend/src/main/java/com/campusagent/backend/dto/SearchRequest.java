package com.campusagent.backend.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a direct catalog search.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

    @NotBlank
    private String query;

    @Min(1)
    @Max(20)
    private Integer limit;

    /**
     * Entries scoring at or below this value are dropped. No filtering when absent.
     */
    @DecimalMax("1.0")
    private Double scoreThreshold;
}
