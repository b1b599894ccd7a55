package com.campusagent.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Final result of one pass through the query pipeline.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssistantReply {

    private String text;

    private IntentKind intent;

    /**
     * Phrase used against the index; null for casual chat.
     */
    private String searchPhrase;

    @Builder.Default
    private List<ScoredEntry> sources = new ArrayList<>();
}
