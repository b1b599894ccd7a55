package com.campusagent.backend.controller;

import com.campusagent.backend.dto.QueryLogResponse;
import com.campusagent.backend.dto.QueryStatsResponse;
import com.campusagent.backend.service.QueryLogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/analytics")
@Tag(name = "Analytics", description = "Question history and usage statistics")
public class AnalyticsController {

    private final QueryLogService queryLogService;

    public AnalyticsController(QueryLogService queryLogService) {
        this.queryLogService = queryLogService;
    }

    @GetMapping("/history")
    @Operation(summary = "Question history", description = "Most recent questions, newest first")
    public ResponseEntity<List<QueryLogResponse>> history(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(queryLogService.toResponseList(queryLogService.recent(limit)));
    }

    @GetMapping("/stats")
    @Operation(summary = "Question statistics")
    public ResponseEntity<QueryStatsResponse> stats() {
        return ResponseEntity.ok(queryLogService.stats());
    }
}
