package org.newslens.qa.retrieval;

import lombok.extern.slf4j.Slf4j;
import org.newslens.client.NewsVectorSearchClient;
import org.newslens.exception.UpstreamException;
import org.newslens.model.Entity;
import org.newslens.model.FailureKind;
import org.newslens.model.SearchResult;

import java.util.List;

/**
 * Shared mechanics of the similarity search handlers: one unfiltered vector
 * search on the pivot-language question.
 */
@Slf4j
abstract class VectorSearchHandler implements RetrievalHandler {

    private final NewsVectorSearchClient vectorSearchClient;
    private final HandlerMessages messages;

    protected VectorSearchHandler(NewsVectorSearchClient vectorSearchClient, HandlerMessages messages) {
        this.vectorSearchClient = vectorSearchClient;
        this.messages = messages;
    }

    /**
     * Value of the {@code type} metadata tag on degraded results.
     */
    protected abstract String resultType();

    @Override
    public List<SearchResult> retrieve(String query, List<Entity> entities, int topK, String language) {
        List<SearchResult> results;
        try {
            results = vectorSearchClient.search(query, topK, null);
        } catch (UpstreamException e) {
            log.warn("{} search failed ({}): {}", name(), e.getFailureKind().tag(), e.getMessage());
            return List.of(SearchResult.failure("error", resultType(), e.getFailureKind(),
                    messages.get(MessageKey.SEARCH_ERROR, language)));
        } catch (RuntimeException e) {
            log.error("{} search failed unexpectedly: {}", name(), e.getMessage(), e);
            return List.of(SearchResult.failure("error", resultType(), FailureKind.BACKEND_UNAVAILABLE,
                    messages.get(MessageKey.SEARCH_ERROR, language)));
        }

        if (results.isEmpty()) {
            log.info("{} found no documents for \"{}\"", name(), truncate(query));
            return List.of(SearchResult.failure("no_results", resultType(), FailureKind.NOT_FOUND,
                    messages.get(MessageKey.NO_RESULTS, language)));
        }

        log.info("{} retrieved {} documents (topK={})", name(), results.size(), topK);
        return results;
    }

    static String truncate(String text) {
        return text.length() > 100 ? text.substring(0, 100) + "..." : text;
    }
}
