package com.campusagent.backend.controller;

import com.campusagent.backend.BaseE2ETest;
import com.campusagent.backend.dto.CatalogEntryRequest;
import com.campusagent.backend.model.IntentKind;
import com.campusagent.backend.repository.CatalogEntryRepository;
import com.campusagent.backend.repository.QueryLogRepository;
import com.campusagent.backend.service.CatalogService;
import com.campusagent.backend.service.GeminiService;
import com.campusagent.backend.service.GenerativeBackendException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Runs questions through the full pipeline. The test MongoDB has no Atlas
 * vector index, so searches are served by the catalog scan.
 */
@AutoConfigureMockMvc
class AssistantControllerE2ETest extends BaseE2ETest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private CatalogService catalogService;

    @Autowired
    private CatalogEntryRepository catalogEntryRepository;

    @Autowired
    private QueryLogRepository queryLogRepository;

    @MockBean
    private GeminiService geminiService;

    @BeforeEach
    void setUp() {
        catalogEntryRepository.deleteAll();
        queryLogRepository.deleteAll();

        catalogService.create(CatalogEntryRequest.builder()
                .title("Main Library Quiet Floors")
                .description("Silent study on floors three and four")
                .category("Libraries")
                .url("https://lib.example.edu/quiet")
                .build());
        catalogService.create(CatalogEntryRequest.builder()
                .title("Recreation Center")
                .description("Gym pool and climbing wall")
                .category("Recreation")
                .url("https://rec.example.edu")
                .build());
    }

    @Test
    void shouldAnswerSearchFromCatalogScan() throws Exception {
        when(geminiService.generateContent(anyList(), anyInt(), eq(0.4))).thenReturn(
                "{\"isSearching\": true, "
                        + "\"searchQuery\": \"Main Library Quiet Floors Silent study on floors three and four Libraries\", "
                        + "\"userMessage\": \"Let me find a quiet place for you.\"}");
        when(geminiService.generateContent(anyList(), anyInt(), eq(0.5)))
                .thenThrow(new GenerativeBackendException(GenerativeBackendException.Reason.UNAVAILABLE, "down"));

        mockMvc.perform(post("/api/assistant/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\": \"Where can I study quietly on campus?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.intent").value("SEARCH"))
                .andExpect(jsonPath("$.resources[0].title").value("Main Library Quiet Floors"))
                .andExpect(jsonPath("$.resources[0].score").value(1.0))
                .andExpect(jsonPath("$.text").value(containsString(
                        "1. [Main Library Quiet Floors](https://lib.example.edu/quiet)")));

        assertEquals(1, queryLogRepository.countByIntent(IntentKind.SEARCH));
    }

    @Test
    void shouldAnswerCasualChat() throws Exception {
        when(geminiService.generateContent(anyList(), anyInt(), eq(0.4)))
                .thenReturn("{\"isSearching\": false, \"userMessage\": \"Hello! Ask me about campus.\"}");

        mockMvc.perform(post("/api/assistant/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\": \"hi\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.intent").value("CASUAL_CHAT"))
                .andExpect(jsonPath("$.text").value("Hello! Ask me about campus."))
                .andExpect(jsonPath("$.resources").isEmpty());
    }

    @Test
    void shouldRecordFailedClassification() throws Exception {
        when(geminiService.generateContent(anyList(), anyInt(), eq(0.4)))
                .thenThrow(new GenerativeBackendException(GenerativeBackendException.Reason.UNAVAILABLE, "down"));

        mockMvc.perform(post("/api/assistant/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\": \"hi\"}"))
                .andExpect(status().isBadGateway());

        mockMvc.perform(get("/api/analytics/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalQuestions").value(1))
                .andExpect(jsonPath("$.failedQuestions").value(1));
    }
}
