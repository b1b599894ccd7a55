package com.campusagent.backend.service;

import com.campusagent.backend.dto.QueryLogResponse;
import com.campusagent.backend.dto.QueryStatsResponse;
import com.campusagent.backend.model.AssistantReply;
import com.campusagent.backend.model.IntentKind;
import com.campusagent.backend.model.QueryLog;
import com.campusagent.backend.repository.QueryLogRepository;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Records assistant questions and reports usage statistics.
 * Logging failures never affect the answer returned to the user.
 */
@Service
public class QueryLogService {

    private static final Logger log = LoggerFactory.getLogger(QueryLogService.class);

    private final QueryLogRepository queryLogRepository;
    private final MongoTemplate mongoTemplate;

    public QueryLogService(QueryLogRepository queryLogRepository, MongoTemplate mongoTemplate) {
        this.queryLogRepository = queryLogRepository;
        this.mongoTemplate = mongoTemplate;
    }

    public void recordAnswer(String question, AssistantReply reply, long responseTimeMs) {
        QueryLog entry = QueryLog.builder()
                .question(question)
                .intent(reply.getIntent())
                .searchPhrase(reply.getSearchPhrase())
                .resultsCount(reply.getSources().size())
                .topScore(reply.getSources().isEmpty() ? null : reply.getSources().get(0).score())
                .answer(reply.getText())
                .success(true)
                .responseTimeMs(responseTimeMs)
                .build();
        save(entry);
    }

    public void recordFailure(String question, String errorMessage, long responseTimeMs) {
        QueryLog entry = QueryLog.builder()
                .question(question)
                .intent(IntentKind.FAILED)
                .success(false)
                .errorMessage(errorMessage)
                .responseTimeMs(responseTimeMs)
                .build();
        save(entry);
    }

    /**
     * Most recent questions, newest first.
     */
    public List<QueryLog> recent(int limit) {
        return queryLogRepository.findByOrderByCreatedAtDesc(PageRequest.of(0, Math.max(1, limit)));
    }

    public QueryStatsResponse stats() {
        return QueryStatsResponse.builder()
                .totalQuestions(queryLogRepository.count())
                .searchQuestions(queryLogRepository.countByIntent(IntentKind.SEARCH))
                .casualQuestions(queryLogRepository.countByIntent(IntentKind.CASUAL_CHAT))
                .failedQuestions(queryLogRepository.countBySuccessFalse())
                .averageResponseTimeMs(averageResponseTime())
                .recentQuestions24h(queryLogRepository.countByCreatedAtAfter(
                        Instant.now().minus(Duration.ofHours(24))))
                .build();
    }

    private double averageResponseTime() {
        Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.group().avg("responseTimeMs").as("average"));
        AggregationResults<Document> results = mongoTemplate.aggregate(aggregation, QueryLog.class, Document.class);
        Document result = results.getUniqueMappedResult();
        if (result == null || !(result.get("average") instanceof Number average)) {
            return 0.0;
        }
        return Math.round(average.doubleValue() * 100.0) / 100.0;
    }

    private void save(QueryLog entry) {
        try {
            queryLogRepository.save(entry);
        } catch (RuntimeException e) {
            log.warn("Failed to record query log: {}", e.getMessage());
        }
    }

    public QueryLogResponse toResponse(QueryLog entry) {
        return QueryLogResponse.builder()
                .id(entry.getId())
                .question(entry.getQuestion())
                .answer(entry.getAnswer())
                .intent(entry.getIntent())
                .searchPhrase(entry.getSearchPhrase())
                .resultsCount(entry.getResultsCount())
                .topScore(entry.getTopScore())
                .success(entry.isSuccess())
                .errorMessage(entry.getErrorMessage())
                .responseTimeMs(entry.getResponseTimeMs())
                .createdAt(entry.getCreatedAt())
                .build();
    }

    public List<QueryLogResponse> toResponseList(List<QueryLog> entries) {
        return entries.stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }
}
