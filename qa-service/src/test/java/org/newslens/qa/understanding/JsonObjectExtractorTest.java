package org.newslens.qa.understanding;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsonObjectExtractorTest {

    @Test
    void extractsObjectWrappedInProseAndFences() {
        String output = "Sure! Here it is:\n```json\n{\"intent\": \"talk\", \"nested\": {\"a\": 1}}\n```\nThanks.";

        assertThat(JsonObjectExtractor.extractFirst(output))
                .contains("{\"intent\": \"talk\", \"nested\": {\"a\": 1}}");
    }

    @Test
    void bracesInsideStringsAreIgnored() {
        String output = "{\"reasoning\": \"uses } and { and \\\"quotes\\\"\", \"x\": 2} trailing }";

        assertThat(JsonObjectExtractor.extractFirst(output))
                .contains("{\"reasoning\": \"uses } and { and \\\"quotes\\\"\", \"x\": 2}");
    }

    @Test
    void truncatedOutputHasNoObject() {
        assertThat(JsonObjectExtractor.extractFirst("{\"intent\": \"factoid\", \"entities\": [")).isEmpty();
    }

    @Test
    void noBracesHasNoObject() {
        assertThat(JsonObjectExtractor.extractFirst("I cannot help with that")).isEmpty();
        assertThat(JsonObjectExtractor.extractFirst(null)).isEmpty();
    }

    @Test
    void retriesFromLaterBraceWhenEarlierOneNeverCloses() {
        assertThat(JsonObjectExtractor.extractFirst("{ broken {\"ok\": true}")).contains("{\"ok\": true}");
        assertThat(JsonObjectExtractor.extractFirst("} noise {\"ok\": true}")).contains("{\"ok\": true}");
    }
}
