package com.campusagent.backend.controller;

import com.campusagent.backend.dto.AskRequest;
import com.campusagent.backend.dto.AskResponse;
import com.campusagent.backend.dto.ErrorResponse;
import com.campusagent.backend.dto.ScoredEntryResponse;
import com.campusagent.backend.model.AssistantReply;
import com.campusagent.backend.service.GenerativeBackendException;
import com.campusagent.backend.service.QueryLogService;
import com.campusagent.backend.service.QueryOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/assistant")
@Tag(name = "Assistant", description = "Ask questions about university resources")
public class AssistantController {

    private static final Logger log = LoggerFactory.getLogger(AssistantController.class);

    private final QueryOrchestrator queryOrchestrator;
    private final QueryLogService queryLogService;

    public AssistantController(QueryOrchestrator queryOrchestrator, QueryLogService queryLogService) {
        this.queryOrchestrator = queryOrchestrator;
        this.queryLogService = queryLogService;
    }

    @PostMapping("/ask")
    @Operation(summary = "Ask the assistant", description = "Classify the question, search the catalog if needed, and answer")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Answer produced"),
            @ApiResponse(responseCode = "400", description = "Blank or oversized prompt"),
            @ApiResponse(responseCode = "502", description = "Language model unavailable")
    })
    public ResponseEntity<?> ask(@Valid @RequestBody AskRequest request) {
        long start = System.currentTimeMillis();
        String prompt = request.getPrompt().trim();

        try {
            AssistantReply reply = queryOrchestrator.answer(prompt);
            long elapsed = System.currentTimeMillis() - start;
            queryLogService.recordAnswer(prompt, reply, elapsed);

            return ResponseEntity.ok(AskResponse.builder()
                    .text(reply.getText())
                    .intent(reply.getIntent())
                    .searchQuery(reply.getSearchPhrase())
                    .resources(reply.getSources().stream()
                            .map(ScoredEntryResponse::from)
                            .collect(Collectors.toList()))
                    .responseTimeMs(elapsed)
                    .build());
        } catch (GenerativeBackendException e) {
            log.error("Could not classify question ({}): {}", e.getReason(), e.getMessage());
            queryLogService.recordFailure(prompt, e.getMessage(), System.currentTimeMillis() - start);
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(ErrorResponse.builder()
                            .error("The language model is unavailable, please try again later")
                            .details(e.getMessage())
                            .build());
        } catch (RuntimeException e) {
            log.error("Unexpected error answering question", e);
            queryLogService.recordFailure(prompt, e.getMessage(), System.currentTimeMillis() - start);
            return ResponseEntity.internalServerError()
                    .body(ErrorResponse.builder()
                            .error("An error occurred while processing your question")
                            .details(e.getMessage())
                            .build());
        }
    }
}
