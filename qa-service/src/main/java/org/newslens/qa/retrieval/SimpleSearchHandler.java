package org.newslens.qa.retrieval;

import org.newslens.client.NewsVectorSearchClient;
import org.newslens.model.RetrievalStrategy;
import org.springframework.stereotype.Component;

/**
 * Similarity search for factoid questions. Entities are ignored.
 */
@Component
public class SimpleSearchHandler extends VectorSearchHandler {

    public static final String NAME = "SimpleSearchHandler";

    public SimpleSearchHandler(NewsVectorSearchClient vectorSearchClient, HandlerMessages messages) {
        super(vectorSearchClient, messages);
    }

    @Override
    public RetrievalStrategy strategy() {
        return RetrievalStrategy.SIMPLE_SEARCH;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String resultType() {
        return "simple_search";
    }
}
