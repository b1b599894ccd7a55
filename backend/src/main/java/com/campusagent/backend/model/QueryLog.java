package com.campusagent.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One answered (or failed) assistant question, kept for analytics.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "query_logs")
public class QueryLog {

    @Id
    private String id;

    private String question;

    @Indexed
    private IntentKind intent;

    private String searchPhrase;

    private int resultsCount;

    /**
     * Score of the best-ranked entry, null when nothing was retrieved.
     */
    private Double topScore;

    private String answer;

    private boolean success;

    private String errorMessage;

    private long responseTimeMs;

    @Indexed
    @CreatedDate
    private Instant createdAt;
}
