package org.newslens.qa.retrieval;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.newslens.client.NewsVectorSearchClient;
import org.newslens.exception.UpstreamTimeoutException;
import org.newslens.model.FailureKind;
import org.newslens.model.SearchResult;
import org.newslens.qa.config.QaProperties;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class VectorSearchHandlerTest {

    private NewsVectorSearchClient vectorSearchClient;
    private HandlerMessages messages;

    @BeforeEach
    void setUp() {
        vectorSearchClient = mock(NewsVectorSearchClient.class);
        messages = new HandlerMessages(new QaProperties());
    }

    @Test
    void simpleSearchReturnsDocumentsAsIs() {
        SearchResult doc = SearchResult.builder()
                .docId("news-1")
                .content("Bakıda yeni metro stansiyası açıldı")
                .score(0.82)
                .metadata(Map.of(SearchResult.META_SOURCE, "report.az"))
                .build();
        when(vectorSearchClient.search("metro stansiyası", 7, null)).thenReturn(List.of(doc));

        List<SearchResult> results = new SimpleSearchHandler(vectorSearchClient, messages)
                .retrieve("metro stansiyası", List.of(), 7, "az");

        assertThat(results).containsExactly(doc);
        verify(vectorSearchClient).search("metro stansiyası", 7, null);
    }

    @Test
    void noDocumentsIsNotFound() {
        when(vectorSearchClient.search(anyString(), anyInt(), isNull())).thenReturn(List.of());

        List<SearchResult> results = new SimpleSearchHandler(vectorSearchClient, messages)
                .retrieve("nothing", List.of(), 5, "en");

        assertThat(results).singleElement().satisfies(result -> {
            assertThat(result.getDocId()).isEqualTo("no_results");
            assertThat(result.getFailure()).isEqualTo(FailureKind.NOT_FOUND.tag());
            assertThat(result.getMetadata()).containsEntry(SearchResult.META_TYPE, "simple_search");
            assertThat(result.getContent()).isEqualTo(messages.get(MessageKey.NO_RESULTS, "en"));
        });
    }

    @Test
    void searchFailureIsLocalizedError() {
        when(vectorSearchClient.search(anyString(), anyInt(), isNull()))
                .thenThrow(new UpstreamTimeoutException("vector search timed out", null));

        List<SearchResult> results = new UnknownHandler(vectorSearchClient, messages)
                .retrieve("something vague", List.of(), 5, "ru");

        assertThat(results).singleElement().satisfies(result -> {
            assertThat(result.isError()).isTrue();
            assertThat(result.getFailure()).isEqualTo(FailureKind.UPSTREAM_TIMEOUT.tag());
            assertThat(result.getMetadata()).containsEntry(SearchResult.META_TYPE, "hybrid_search");
            assertThat(result.getContent()).isEqualTo(messages.get(MessageKey.SEARCH_ERROR, "ru"));
        });
    }

    @Test
    void unexpectedFailureIsBackendUnavailable() {
        when(vectorSearchClient.search(anyString(), anyInt(), isNull()))
                .thenThrow(new IllegalStateException("pool closed"));

        List<SearchResult> results = new SimpleSearchHandler(vectorSearchClient, messages)
                .retrieve("query", List.of(), 5, "en");

        assertThat(results).singleElement()
                .satisfies(result -> assertThat(result.getFailure()).isEqualTo(FailureKind.BACKEND_UNAVAILABLE.tag()));
    }
}
