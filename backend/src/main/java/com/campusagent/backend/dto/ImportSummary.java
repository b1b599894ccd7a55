package com.campusagent.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a categorized catalog import.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportSummary {

    private int totalProcessed;
    private int totalCategories;
    private int successful;
    private int failed;

    @Builder.Default
    private List<CategoryResult> details = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CategoryResult {
        private String category;
        private int processed;
        private int successful;
        private int failed;

        @Builder.Default
        private List<String> errors = new ArrayList<>();
    }
}
