package org.newslens.qa.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.newslens.client.CompletionClient;
import org.newslens.client.NewsDatabaseClient;
import org.newslens.client.NewsVectorSearchClient;
import org.newslens.exception.QueryValidationException;
import org.newslens.qa.config.QaProperties;
import org.newslens.qa.model.AskRequest;
import org.newslens.qa.model.AskResponse;
import org.newslens.qa.model.BatchAskRequest;
import org.newslens.qa.service.QuestionAnsweringService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for news question answering.
 *
 * <h3>Usage examples</h3>
 * <pre>
 * # Ask a question
 * curl -X POST http://localhost:8080/api/chat/ask \
 *   -H "Content-Type: application/json" \
 *   -d '{"query": "2025-ci ildə ən önəmli xəbərlər hansılardır?"}'
 *
 * # Several questions at once
 * curl -X POST http://localhost:8080/api/chat/ask/batch \
 *   -H "Content-Type: application/json" \
 *   -d '{"queries": ["Salam", "What happened in Baku today?"]}'
 * </pre>
 */
@Slf4j
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
public class QaController {

    private static final String HEALTH_SYSTEM_PROMPT = "Reply with the single word OK.";

    private final QuestionAnsweringService questionAnsweringService;
    private final CompletionClient completionClient;
    private final NewsVectorSearchClient vectorSearchClient;
    private final NewsDatabaseClient databaseClient;
    private final QaProperties properties;

    @PostMapping("/ask")
    public ResponseEntity<AskResponse> ask(@RequestBody AskRequest request) {
        log.info("Ask request: topK={}", request.getTopK());
        return ResponseEntity.ok(AskResponse.from(questionAnsweringService.answer(request.getQuery(), request.getTopK())));
    }

    @PostMapping("/ask/batch")
    public ResponseEntity<List<AskResponse>> askBatch(@RequestBody BatchAskRequest request) {
        List<String> queries = request.getQueries() != null ? request.getQueries() : List.of();
        return ResponseEntity.ok(questionAnsweringService.answerBatch(queries).stream()
                .map(AskResponse::from)
                .toList());
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Map<String, Object>> clearCache() {
        questionAnsweringService.clearCache();
        return ResponseEntity.ok(Map.of("status", "cleared"));
    }

    /**
     * Reports whether the completion model, vector store and database answer.
     * Each check makes one minimal call to its backend.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new LinkedHashMap<>();

        try {
            completionClient.complete(HEALTH_SYSTEM_PROMPT, "ping", false);
            health.put("completion", Map.of("status", "UP"));
        } catch (Exception e) {
            log.error("Completion health check failed: {}", e.getMessage());
            health.put("completion", Map.of("status", "DOWN", "error", String.valueOf(e.getMessage())));
        }

        try {
            vectorSearchClient.search("health check", 1, null);
            health.put("vectorStore", Map.of("status", "UP"));
        } catch (Exception e) {
            log.error("Vector store health check failed: {}", e.getMessage());
            health.put("vectorStore", Map.of("status", "DOWN", "error", String.valueOf(e.getMessage())));
        }

        try {
            databaseClient.describeSchema(properties.getStatistics().getAllowedTables());
            health.put("database", Map.of("status", "UP"));
        } catch (Exception e) {
            log.error("Database health check failed: {}", e.getMessage());
            health.put("database", Map.of("status", "DOWN", "error", String.valueOf(e.getMessage())));
        }

        boolean allUp = health.values().stream()
                .filter(v -> v instanceof Map)
                .allMatch(v -> "UP".equals(((Map<?, ?>) v).get("status")));
        health.put("status", allUp ? "UP" : "DEGRADED");

        return ResponseEntity.ok(health);
    }

    @ExceptionHandler(QueryValidationException.class)
    public ResponseEntity<Map<String, String>> handleValidation(QueryValidationException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
