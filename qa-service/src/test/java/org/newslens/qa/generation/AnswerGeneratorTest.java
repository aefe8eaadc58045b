package org.newslens.qa.generation;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.newslens.client.CompletionClient;
import org.newslens.exception.UpstreamMalformedResponseException;
import org.newslens.model.AnswerConfidence;
import org.newslens.model.FailureKind;
import org.newslens.model.SearchResult;
import org.newslens.model.SourceInfo;
import org.newslens.qa.config.QaProperties;
import org.newslens.qa.retrieval.HandlerMessages;
import org.newslens.qa.retrieval.MessageKey;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AnswerGeneratorTest {

    private CompletionClient completionClient;
    private HandlerMessages messages;
    private AnswerGenerator generator;

    private final SearchResult metro = SearchResult.builder()
            .docId("news-1")
            .content("Bakıda yeni metro stansiyası açıldı.")
            .score(0.8123)
            .metadata(Map.of(
                    SearchResult.META_SOURCE, "report.az",
                    SearchResult.META_URL, "https://report.az/metro",
                    SearchResult.META_CATEGORY, "infrastructure",
                    SearchResult.META_IMPORTANCE, 7,
                    SearchResult.META_DATE, "2025-03-01"))
            .build();

    private final SearchResult bare = SearchResult.builder()
            .docId("news-2")
            .content("Metro qatarları yeniləndi.")
            .score(0.5)
            .build();

    @BeforeEach
    void setUp() {
        completionClient = mock(CompletionClient.class);
        messages = new HandlerMessages(new QaProperties());
        generator = new AnswerGenerator(completionClient, messages, new ObjectMapper());
    }

    @Test
    void noEvidenceSkipsTheModel() {
        GeneratedAnswer answer = generator.generate("metro", List.of(), "az");

        assertThat(answer.answer()).isEqualTo(messages.get(MessageKey.NO_INFORMATION, "az"));
        assertThat(answer.confidence()).isEqualTo(AnswerConfidence.LOW);
        assertThat(answer.sources()).isEmpty();
        assertThat(answer.degraded()).isFalse();
        verifyNoInteractions(completionClient);
    }

    @Test
    void handlerMessagesAreReturnedVerbatim() {
        SearchResult greeting = SearchResult.directAnswer("greeting", "talk", "Salam! Necə kömək edə bilərəm?");

        GeneratedAnswer answer = generator.generate("Salam", List.of(greeting), "az");

        assertThat(answer.answer()).isEqualTo("Salam! Necə kömək edə bilərəm?");
        assertThat(answer.confidence()).isEqualTo(AnswerConfidence.HIGH);
        assertThat(answer.degraded()).isFalse();
        verifyNoInteractions(completionClient);
    }

    @Test
    void failureMessagesAreLowConfidenceAndErrorsAreDegraded() {
        SearchResult rejected = SearchResult.failure("security_warning", "attacking",
                FailureKind.SECURITY_REJECTION, "Rejected.");
        SearchResult broken = SearchResult.failure("error", "statistics",
                FailureKind.BACKEND_UNAVAILABLE, "Broken.");

        GeneratedAnswer rejection = generator.generate("x", List.of(rejected), "en");
        GeneratedAnswer error = generator.generate("x", List.of(broken), "en");

        assertThat(rejection.confidence()).isEqualTo(AnswerConfidence.LOW);
        assertThat(rejection.degraded()).isFalse();
        assertThat(error.confidence()).isEqualTo(AnswerConfidence.LOW);
        assertThat(error.degraded()).isTrue();
        verifyNoInteractions(completionClient);
    }

    @Test
    void answersFromEvidenceAndResolvesSources() {
        when(completionClient.complete(anyString(), anyString(), eq(true))).thenReturn("""
                {
                  "answer": "Bakıda yeni metro stansiyası açılıb.",
                  "sources": [
                    {"id": "news-1"},
                    {"id": "news-2", "name": "APA", "url": "https://apa.az/2"},
                    {"id": "news-1", "name": "duplicate"},
                    {"id": "news-9"}
                  ],
                  "confidence": "medium",
                  "key_facts": ["Yeni stansiya açıldı", 42, ""]
                }
                """);

        GeneratedAnswer answer = generator.generate("Bakıda metro", List.of(metro, bare), "az");

        assertThat(answer.answer()).isEqualTo("Bakıda yeni metro stansiyası açılıb.");
        assertThat(answer.confidence()).isEqualTo(AnswerConfidence.MEDIUM);
        assertThat(answer.keyFacts()).containsExactly("Yeni stansiya açıldı");
        assertThat(answer.sources()).containsExactly(
                new SourceInfo("news-1", "report.az", "https://report.az/metro"),
                new SourceInfo("news-2", "APA", "https://apa.az/2"),
                new SourceInfo("news-9", "Unknown", null));
        assertThat(answer.degraded()).isFalse();
        verify(completionClient).complete(anyString(), contains("[NEWS #1]"), eq(true));
    }

    @Test
    void modelFailureIsDegraded() {
        when(completionClient.complete(anyString(), anyString(), eq(true)))
                .thenThrow(new UpstreamMalformedResponseException("empty completion"));

        GeneratedAnswer answer = generator.generate("metro", List.of(metro), "ru");

        assertThat(answer.answer()).isEqualTo(messages.get(MessageKey.GENERATION_ERROR, "ru"));
        assertThat(answer.confidence()).isEqualTo(AnswerConfidence.LOW);
        assertThat(answer.degraded()).isTrue();
    }

    @Test
    void answerWithoutTextIsDegraded() {
        when(completionClient.complete(anyString(), anyString(), eq(true)))
                .thenReturn("{\"answer\": \"  \", \"confidence\": \"high\"}");

        assertThat(generator.generate("metro", List.of(metro), "en").degraded()).isTrue();
    }

    @Test
    void contextHasFixedLayout() {
        String context = AnswerGenerator.formatContext(List.of(metro, bare));

        assertThat(context).startsWith("=".repeat(80) + "\n[NEWS #1]\nID: news-1\nSource: report.az\n");
        assertThat(context).contains("Importance: 7\nDate: 2025-03-01\nRelevance: 0.812\n\nCONTENT:\n");
        assertThat(context).contains("[NEWS #2]\nID: news-2\nSource: Unknown\nURL: N/A\nCategory: N/A\n");
        assertThat(context).contains("Relevance: 0.500");
    }
}
