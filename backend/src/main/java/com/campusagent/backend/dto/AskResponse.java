package com.campusagent.backend.dto;

import com.campusagent.backend.model.IntentKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for assistant answers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AskResponse {

    private String text;
    private IntentKind intent;
    private String searchQuery;
    private List<ScoredEntryResponse> resources;
    private long responseTimeMs;
}
