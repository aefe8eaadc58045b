package org.newslens.model;

import java.util.List;

/**
 * Output of the retrieval stage for one question.
 *
 * @param processedQuery question text after understanding
 * @param analysis       intent, entities and keywords
 * @param strategy       strategy the router selected
 * @param searchResults  evidence returned by the handler, never empty
 * @param handlerUsed    simple name of the handler that ran
 */
public record RetrievalResult(
        ProcessedQuery processedQuery,
        QueryAnalysis analysis,
        RetrievalStrategy strategy,
        List<SearchResult> searchResults,
        String handlerUsed
) {

    public RetrievalResult {
        searchResults = searchResults != null ? List.copyOf(searchResults) : List.of();
    }
}
