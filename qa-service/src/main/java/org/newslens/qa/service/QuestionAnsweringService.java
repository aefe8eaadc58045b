package org.newslens.qa.service;

import lombok.extern.slf4j.Slf4j;
import org.newslens.cache.ResponseCache;
import org.newslens.exception.QueryValidationException;
import org.newslens.model.AnswerConfidence;
import org.newslens.model.FailureKind;
import org.newslens.model.Intent;
import org.newslens.model.ProcessedQuery;
import org.newslens.model.QAResponse;
import org.newslens.model.QueryAnalysis;
import org.newslens.model.RetrievalResult;
import org.newslens.model.RetrievalStrategy;
import org.newslens.model.SearchResult;
import org.newslens.qa.config.QaProperties;
import org.newslens.qa.generation.AnswerGenerator;
import org.newslens.qa.generation.GeneratedAnswer;
import org.newslens.qa.retrieval.HandlerMessages;
import org.newslens.qa.retrieval.MessageKey;
import org.newslens.qa.retrieval.RetrievalDispatcher;
import org.newslens.qa.retrieval.RetrievalHandler;
import org.newslens.qa.routing.StrategyRouter;
import org.newslens.qa.understanding.QueryUnderstandingService;
import org.newslens.qa.understanding.UnderstoodQuery;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;

/**
 * Question answering pipeline.
 *
 * <p>Runs, strictly in sequence for one question:
 * <ol>
 *   <li><strong>Cache</strong>: a hit returns the stored response without touching any backend</li>
 *   <li><strong>Understand</strong>: language, pivot translation, entities and intent</li>
 *   <li><strong>Route</strong>: intent to retrieval strategy</li>
 *   <li><strong>Retrieve</strong>: exactly one handler, never retried under another strategy</li>
 *   <li><strong>Generate</strong>: cited answer in the original language</li>
 * </ol>
 *
 * <p>Only an empty question raises an exception; every other failure is absorbed
 * into a well-formed response with low confidence. Degraded responses are not cached.</p>
 */
@Slf4j
@Service
public class QuestionAnsweringService {

    private final QueryUnderstandingService understandingService;
    private final StrategyRouter router;
    private final RetrievalDispatcher dispatcher;
    private final AnswerGenerator answerGenerator;
    private final ResponseCache responseCache;
    private final HandlerMessages messages;
    private final QaProperties properties;
    private final Executor batchExecutor;

    /**
     * Creates the question answering service.
     *
     * @param understandingService query understanding stage
     * @param router               intent to strategy mapping
     * @param dispatcher           strategy to handler table
     * @param answerGenerator      answer generation stage
     * @param responseCache        response cache placed in front of the pipeline
     * @param messages             localized fallback messages
     * @param properties           question answering settings
     * @param batchExecutor        bounded executor for {@link #answerBatch(List)}
     */
    public QuestionAnsweringService(QueryUnderstandingService understandingService,
                                    StrategyRouter router,
                                    RetrievalDispatcher dispatcher,
                                    AnswerGenerator answerGenerator,
                                    ResponseCache responseCache,
                                    HandlerMessages messages,
                                    QaProperties properties,
                                    @Qualifier("batchAnswerExecutor") Executor batchExecutor) {
        this.understandingService = understandingService;
        this.router = router;
        this.dispatcher = dispatcher;
        this.answerGenerator = answerGenerator;
        this.responseCache = responseCache;
        this.messages = messages;
        this.properties = properties;
        this.batchExecutor = batchExecutor;
    }

    /**
     * Answers one question.
     *
     * @param query question in any language
     * @param topK  number of documents to retrieve, {@code null} for the configured default
     * @return the answer, never {@code null}
     * @throws QueryValidationException if the question is null or blank
     */
    public QAResponse answer(String query, Integer topK) {
        if (query == null || query.isBlank()) {
            throw new QueryValidationException("Query must not be empty");
        }
        long start = System.currentTimeMillis();
        int k = resolveTopK(topK);

        boolean cacheEnabled = properties.getCache().isEnabled();
        String cacheKey = null;
        if (cacheEnabled) {
            cacheKey = responseCache.generateKey(query, Map.of("top_k", k));
            Optional<QAResponse> cached = responseCache.get(cacheKey);
            if (cached.isPresent()) {
                log.info("Cache hit for {}", cacheKey);
                return cached.get();
            }
        }

        log.info("Processing question: \"{}\" (topK={})", abbreviate(query), k);

        // --- 1. UNDERSTAND ---
        UnderstoodQuery understood = understandingService.understand(query);
        ProcessedQuery processed = understood.processed();
        QueryAnalysis analysis = understood.analysis();
        String language = processed.language();

        // --- 2. ROUTE + RETRIEVE ---
        RetrievalResult retrieval = retrieve(processed, analysis, k);

        // --- 3. GENERATE ---
        GeneratedAnswer generated = answerGenerator.generate(query, retrieval.searchResults(), language);

        QAResponse response = QAResponse.builder()
                .query(query)
                .language(language)
                .intent(analysis.intent())
                .answer(generated.answer())
                .sources(generated.sources())
                .confidence(generated.confidence())
                .keyFacts(generated.keyFacts())
                .searchResults(retrieval.searchResults())
                .totalFound(retrieval.searchResults().size())
                .handlerUsed(retrieval.handlerUsed())
                .build();

        if (cacheEnabled && !generated.degraded()) {
            responseCache.set(cacheKey, response, properties.getCache().getTtl());
        }

        log.info("QA complete in {}ms: handler={}, confidence={}, sources={}, docs={}",
                System.currentTimeMillis() - start, response.getHandlerUsed(),
                response.getConfidence().label(), response.getSources().size(), response.getTotalFound());
        return response;
    }

    private RetrievalResult retrieve(ProcessedQuery processed, QueryAnalysis analysis, int topK) {
        RetrievalStrategy strategy = router.route(analysis);
        RetrievalHandler handler = dispatcher.handlerFor(strategy);
        log.info("Routing intent={} to {} ({}) via {}",
                analysis.intent().label(), strategy.label(), router.describe(strategy), handler.name());

        List<SearchResult> results;
        try {
            results = handler.retrieve(processed.corrected(), analysis.entities(), topK, processed.language());
        } catch (RuntimeException e) {
            log.error("{} broke its no-throw contract: {}", handler.name(), e.getMessage(), e);
            results = List.of(SearchResult.failure("error", strategy.label(), FailureKind.BACKEND_UNAVAILABLE,
                    messages.get(MessageKey.SEARCH_ERROR, processed.language())));
        }
        return new RetrievalResult(processed, analysis, strategy, results, handler.name());
    }

    /**
     * Answers several questions concurrently on the batch executor.
     *
     * <p>Results keep the input order. A question that fails, including an empty one,
     * becomes an error response and does not affect the others. If the calling thread
     * is interrupted, outstanding questions are cancelled and reported as errors.</p>
     */
    public List<QAResponse> answerBatch(List<String> queries) {
        log.info("Processing batch: {} questions", queries.size());

        List<Future<QAResponse>> futures = new ArrayList<>(queries.size());
        for (String query : queries) {
            FutureTask<QAResponse> task = new FutureTask<>(() -> answerOrError(query));
            try {
                batchExecutor.execute(task);
                futures.add(task);
            } catch (RejectedExecutionException e) {
                log.warn("Batch executor saturated, rejecting question: {}", e.getMessage());
                futures.add(CompletableFuture.completedFuture(errorResponse(query)));
            }
        }

        List<QAResponse> responses = new ArrayList<>(queries.size());
        boolean interrupted = false;
        for (int i = 0; i < futures.size(); i++) {
            Future<QAResponse> future = futures.get(i);
            if (interrupted) {
                future.cancel(true);
                responses.add(errorResponse(queries.get(i)));
                continue;
            }
            try {
                responses.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                future.cancel(true);
                responses.add(errorResponse(queries.get(i)));
            } catch (ExecutionException | CancellationException e) {
                log.error("Batch item failed: {}", e.getMessage(), e);
                responses.add(errorResponse(queries.get(i)));
            }
        }

        long failed = responses.stream().filter(r -> QAResponse.ERROR_HANDLER.equals(r.getHandlerUsed())).count();
        log.info("Batch complete: {}/{} successful", responses.size() - failed, queries.size());
        return responses;
    }

    private QAResponse answerOrError(String query) {
        try {
            return answer(query, null);
        } catch (RuntimeException e) {
            log.error("Failed to process \"{}\": {}", abbreviate(query), e.getMessage());
            return errorResponse(query);
        }
    }

    private QAResponse errorResponse(String query) {
        return QAResponse.builder()
                .query(query)
                .language("unknown")
                .intent(Intent.UNKNOWN)
                .answer(messages.get(MessageKey.PIPELINE_ERROR, "unknown"))
                .confidence(AnswerConfidence.LOW)
                .totalFound(0)
                .handlerUsed(QAResponse.ERROR_HANDLER)
                .build();
    }

    /**
     * Removes every cached response.
     */
    public void clearCache() {
        responseCache.clear();
    }

    int resolveTopK(Integer requested) {
        int k = requested != null ? requested : properties.getDefaultTopK();
        return Math.min(Math.max(k, 1), properties.getMaxTopK());
    }

    private static String abbreviate(String query) {
        return query == null || query.length() <= 100 ? query : query.substring(0, 100) + "...";
    }
}
