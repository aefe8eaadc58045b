package org.newslens.qa.retrieval;

import org.newslens.model.Entity;
import org.newslens.model.RetrievalStrategy;
import org.newslens.model.SearchResult;

import java.util.List;

/**
 * Concrete implementation of one {@link RetrievalStrategy}.
 *
 * <p>Implementations never throw: backend failures come back as a single
 * {@link SearchResult} with score 0, the {@code error} tag and a message in the
 * caller's language. The returned list is never empty.</p>
 */
public interface RetrievalHandler {

    RetrievalStrategy strategy();

    /**
     * Tag reported as {@code handler_used}.
     */
    String name();

    /**
     * @param query    question in the pivot language
     * @param entities extracted entities, currently not used for filtering
     * @param topK     maximum number of results
     * @param language language of the original question, used for messages
     */
    List<SearchResult> retrieve(String query, List<Entity> entities, int topK, String language);
}
