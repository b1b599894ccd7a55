package com.campusagent.backend.dto;

import com.campusagent.backend.model.IntentKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryLogResponse {

    private String id;
    private String question;
    private String answer;
    private IntentKind intent;
    private String searchPhrase;
    private int resultsCount;
    private Double topScore;
    private boolean success;
    private String errorMessage;
    private long responseTimeMs;
    private Instant createdAt;
}
