package org.newslens.qa.retrieval;

import lombok.extern.slf4j.Slf4j;
import org.newslens.client.NewsVectorSearchClient;
import org.newslens.model.Entity;
import org.newslens.model.RetrievalStrategy;
import org.newslens.model.SearchResult;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fallback for analytical and unclassified questions. Same search as
 * {@link SimpleSearchHandler}, tagged separately so ambiguous routing shows up
 * in {@code handler_used}.
 */
@Slf4j
@Component
public class UnknownHandler extends VectorSearchHandler {

    public static final String NAME = "UnknownHandler";

    public UnknownHandler(NewsVectorSearchClient vectorSearchClient, HandlerMessages messages) {
        super(vectorSearchClient, messages);
    }

    @Override
    public RetrievalStrategy strategy() {
        return RetrievalStrategy.HYBRID_SEARCH;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String resultType() {
        return "hybrid_search";
    }

    @Override
    public List<SearchResult> retrieve(String query, List<Entity> entities, int topK, String language) {
        log.warn("Falling back to plain similarity search for \"{}\"", truncate(query));
        return super.retrieve(query, entities, topK, language);
    }
}
