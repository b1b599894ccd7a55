package com.campusagent.backend.controller;

import com.campusagent.backend.model.IntentKind;
import com.campusagent.backend.model.QueryLog;
import com.campusagent.backend.repository.QueryLogRepository;
import com.campusagent.backend.service.QueryLogService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AnalyticsControllerTest {

    private QueryLogRepository queryLogRepository;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        queryLogRepository = mock(QueryLogRepository.class);
        QueryLogService queryLogService = new QueryLogService(queryLogRepository, mock(MongoTemplate.class));
        mockMvc = MockMvcBuilders.standaloneSetup(new AnalyticsController(queryLogService)).build();
    }

    @Test
    void historyReturnsNewestFirstWithFailureReason() throws Exception {
        QueryLog newest = QueryLog.builder()
                .id("q2")
                .question("dining hours")
                .intent(IntentKind.FAILED)
                .success(false)
                .errorMessage("Gemini API returned status 503")
                .createdAt(Instant.parse("2024-05-02T10:00:00Z"))
                .build();
        QueryLog older = QueryLog.builder()
                .id("q1")
                .question("where is the gym")
                .intent(IntentKind.SEARCH)
                .searchPhrase("gym location")
                .resultsCount(2)
                .topScore(0.81)
                .success(true)
                .createdAt(Instant.parse("2024-05-01T10:00:00Z"))
                .build();
        when(queryLogRepository.findByOrderByCreatedAtDesc(PageRequest.of(0, 2))).thenReturn(List.of(newest, older));

        mockMvc.perform(get("/api/analytics/history").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].question").value("dining hours"))
                .andExpect(jsonPath("$[0].success").value(false))
                .andExpect(jsonPath("$[0].errorMessage").value("Gemini API returned status 503"))
                .andExpect(jsonPath("$[1].question").value("where is the gym"))
                .andExpect(jsonPath("$[1].topScore").value(0.81));
    }

    @Test
    void historyDefaultsToTwentyEntries() throws Exception {
        when(queryLogRepository.findByOrderByCreatedAtDesc(any(Pageable.class))).thenReturn(List.of());

        mockMvc.perform(get("/api/analytics/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));

        verify(queryLogRepository).findByOrderByCreatedAtDesc(PageRequest.of(0, 20));
    }

    @Test
    void historyLimitIsAtLeastOne() throws Exception {
        when(queryLogRepository.findByOrderByCreatedAtDesc(any(Pageable.class))).thenReturn(List.of());

        mockMvc.perform(get("/api/analytics/history").param("limit", "0"))
                .andExpect(status().isOk());

        verify(queryLogRepository).findByOrderByCreatedAtDesc(PageRequest.of(0, 1));
    }
}
