package com.campusagent.backend.service;

import com.campusagent.backend.BaseE2ETest;
import com.campusagent.backend.dto.QueryLogResponse;
import com.campusagent.backend.dto.QueryStatsResponse;
import com.campusagent.backend.model.AssistantReply;
import com.campusagent.backend.model.CatalogEntry;
import com.campusagent.backend.model.IntentKind;
import com.campusagent.backend.model.QueryLog;
import com.campusagent.backend.model.ScoredEntry;
import com.campusagent.backend.repository.QueryLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueryLogServiceE2ETest extends BaseE2ETest {

    @Autowired
    private QueryLogService queryLogService;

    @Autowired
    private QueryLogRepository queryLogRepository;

    @BeforeEach
    void setUp() {
        queryLogRepository.deleteAll();
    }

    @Test
    void shouldRecordSearchAnswer() {
        // Given
        CatalogEntry entry = CatalogEntry.builder().title("Library").url("https://lib.example.edu").build();
        AssistantReply reply = AssistantReply.builder()
                .text("Here it is")
                .intent(IntentKind.SEARCH)
                .searchPhrase("library location")
                .sources(List.of(new ScoredEntry(entry, 0.82)))
                .build();

        // When
        queryLogService.recordAnswer("Where is the library?", reply, 120);
        List<QueryLog> recent = queryLogService.recent(10);

        // Then
        assertEquals(1, recent.size());
        QueryLog saved = recent.get(0);
        assertEquals("library location", saved.getSearchPhrase());
        assertEquals(1, saved.getResultsCount());
        assertEquals(0.82, saved.getTopScore());
        assertTrue(saved.isSuccess());
        assertNull(saved.getErrorMessage());
        assertNotNull(saved.getCreatedAt());
    }

    @Test
    void shouldExposeFailureReasonInHistory() {
        // Given
        queryLogService.recordFailure("dining hours", "Gemini API returned status 503", 42);

        // When
        List<QueryLogResponse> history = queryLogService.toResponseList(queryLogService.recent(10));

        // Then
        assertEquals(1, history.size());
        QueryLogResponse failed = history.get(0);
        assertFalse(failed.isSuccess());
        assertEquals(IntentKind.FAILED, failed.getIntent());
        assertEquals("Gemini API returned status 503", failed.getErrorMessage());
        assertEquals(42, failed.getResponseTimeMs());
    }

    @Test
    void shouldComputeStats() {
        // Given
        queryLogService.recordAnswer("hi", AssistantReply.builder()
                .text("Hello")
                .intent(IntentKind.CASUAL_CHAT)
                .build(), 100);
        queryLogService.recordAnswer("gym hours", AssistantReply.builder()
                .text("Gym opens at 6")
                .intent(IntentKind.SEARCH)
                .searchPhrase("gym hours")
                .build(), 200);
        queryLogService.recordFailure("dining", "Gemini API returned status 503", 301);

        // When
        QueryStatsResponse stats = queryLogService.stats();

        // Then
        assertEquals(3, stats.getTotalQuestions());
        assertEquals(1, stats.getSearchQuestions());
        assertEquals(1, stats.getCasualQuestions());
        assertEquals(1, stats.getFailedQuestions());
        assertEquals(200.33, stats.getAverageResponseTimeMs());
        assertEquals(3, stats.getRecentQuestions24h());
    }

    @Test
    void shouldReturnRecentNewestFirst() throws InterruptedException {
        // Given
        queryLogService.recordFailure("first", "err", 10);
        Thread.sleep(20);
        queryLogService.recordFailure("second", "err", 10);

        // When
        List<QueryLog> recent = queryLogService.recent(1);

        // Then
        assertEquals(1, recent.size());
        assertEquals("second", recent.get(0).getQuestion());
    }
}
