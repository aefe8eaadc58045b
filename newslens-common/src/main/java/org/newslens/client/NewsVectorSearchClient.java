package org.newslens.client;

import lombok.extern.slf4j.Slf4j;
import org.newslens.model.SearchResult;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.ai.vectorstore.filter.FilterExpressionBuilder;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Similarity search over the news article index.
 *
 * <p>Each hit maps to a {@link SearchResult}: the document id comes from the
 * {@code doc_id} metadata key (falling back to the vector store id), the content
 * from {@code full_content} (falling back to the indexed text).</p>
 */
@Slf4j
public class NewsVectorSearchClient {

    public static final String BACKEND = "vector-store";

    private static final String META_DOC_ID = "doc_id";
    private static final String META_FULL_CONTENT = "full_content";

    private final VectorStore vectorStore;
    private final UpstreamCallExecutor callExecutor;
    private final Duration timeout;
    private final double minScore;

    public NewsVectorSearchClient(VectorStore vectorStore, UpstreamCallExecutor callExecutor,
                                  Duration timeout, double minScore) {
        this.vectorStore = vectorStore;
        this.callExecutor = callExecutor;
        this.timeout = timeout;
        this.minScore = minScore;
    }

    /**
     * Runs a similarity search.
     *
     * @param query   text to embed and search for
     * @param topK    maximum number of hits
     * @param filters metadata equality filters combined with AND, may be {@code null}
     * @return hits ordered by descending score
     */
    public List<SearchResult> search(String query, int topK, Map<String, Object> filters) {
        SearchRequest.Builder request = SearchRequest.builder()
                .query(query)
                .topK(topK)
                .similarityThreshold(minScore);

        if (filters != null && !filters.isEmpty()) {
            request.filterExpression(toFilterExpression(filters).build());
        }
        SearchRequest searchRequest = request.build();

        long start = System.currentTimeMillis();
        List<Document> documents = callExecutor.call(BACKEND, timeout,
                () -> vectorStore.similaritySearch(searchRequest));
        List<Document> hits = documents != null ? documents : List.of();

        log.debug("Vector search returned {} hits in {}ms (topK={})",
                hits.size(), System.currentTimeMillis() - start, topK);

        return hits.stream().map(this::toSearchResult).toList();
    }

    private FilterExpressionBuilder.Op toFilterExpression(Map<String, Object> filters) {
        FilterExpressionBuilder b = new FilterExpressionBuilder();
        FilterExpressionBuilder.Op combined = null;
        for (Map.Entry<String, Object> entry : filters.entrySet()) {
            FilterExpressionBuilder.Op op = b.eq(entry.getKey(), entry.getValue());
            combined = combined == null ? op : b.and(combined, op);
        }
        return combined;
    }

    private SearchResult toSearchResult(Document document) {
        Map<String, Object> metadata = document.getMetadata();
        Object docId = metadata.get(META_DOC_ID);
        Object fullContent = metadata.get(META_FULL_CONTENT);

        return SearchResult.builder()
                .docId(docId != null ? docId.toString() : document.getId())
                .content(fullContent != null ? fullContent.toString() : document.getText())
                .score(document.getScore() != null ? document.getScore() : 0d)
                .metadata(metadata)
                .build();
    }
}
