package org.newslens.qa.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.newslens.model.QAResponse;
import org.newslens.model.SearchResult;
import org.newslens.model.SourceInfo;

import java.util.List;

/**
 * Wire form of an answer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AskResponse {

    private static final int PREVIEW_LENGTH = 200;

    private String query;
    private String language;
    private String intent;
    private String answer;
    private List<SourceInfo> sources;
    private String confidence;

    @JsonProperty("key_facts")
    private List<String> keyFacts;

    @JsonProperty("retrieved_documents")
    private List<RetrievedDocument> retrievedDocuments;

    @JsonProperty("total_found")
    private int totalFound;

    @JsonProperty("handler_used")
    private String handlerUsed;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RetrievedDocument {

        @JsonProperty("doc_id")
        private String docId;

        private double score;
        private Object category;
        private Object importance;
        private Object source;
        private Object url;

        /** First 200 characters of the content. */
        private String preview;
    }

    public static AskResponse from(QAResponse response) {
        return AskResponse.builder()
                .query(response.getQuery())
                .language(response.getLanguage())
                .intent(response.getIntent() != null ? response.getIntent().label() : null)
                .answer(response.getAnswer())
                .sources(response.getSources())
                .confidence(response.getConfidence() != null ? response.getConfidence().label() : null)
                .keyFacts(response.getKeyFacts())
                .retrievedDocuments(response.getSearchResults().stream().map(AskResponse::toDocument).toList())
                .totalFound(response.getTotalFound())
                .handlerUsed(response.getHandlerUsed())
                .build();
    }

    private static RetrievedDocument toDocument(SearchResult result) {
        String content = result.getContent();
        return RetrievedDocument.builder()
                .docId(result.getDocId())
                .score(result.getScore())
                .category(result.getMetadata().get(SearchResult.META_CATEGORY))
                .importance(result.getMetadata().get(SearchResult.META_IMPORTANCE))
                .source(result.getMetadata().get(SearchResult.META_SOURCE))
                .url(result.getMetadata().get(SearchResult.META_URL))
                .preview(content.length() > PREVIEW_LENGTH ? content.substring(0, PREVIEW_LENGTH) : content)
                .build();
    }
}
