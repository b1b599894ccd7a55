package com.campusagent.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate statistics over logged questions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryStatsResponse {

    private long totalQuestions;
    private long searchQuestions;
    private long casualQuestions;
    private long failedQuestions;
    private double averageResponseTimeMs;
    private long recentQuestions24h;
}
