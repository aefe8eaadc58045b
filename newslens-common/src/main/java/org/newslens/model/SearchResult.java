package org.newslens.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One piece of evidence returned by a retrieval handler.
 *
 * <p>Besides the article fields ({@code category}, {@code importance}, {@code source},
 * {@code url}, {@code date}) the metadata bag carries handler tags:
 * {@link #META_TYPE}, {@link #META_DIRECT_ANSWER}, {@link #META_ERROR} and
 * {@link #META_FAILURE}.</p>
 */
@Value
public class SearchResult {

    public static final String META_TYPE = "type";
    public static final String META_DIRECT_ANSWER = "direct_answer";
    public static final String META_ERROR = "error";
    public static final String META_FAILURE = "failure";

    public static final String META_CATEGORY = "category";
    public static final String META_IMPORTANCE = "importance";
    public static final String META_SOURCE = "source";
    public static final String META_URL = "url";
    public static final String META_DATE = "date";

    String docId;
    String content;
    double score;
    Map<String, Object> metadata;

    @Builder(toBuilder = true)
    @Jacksonized
    public SearchResult(String docId, String content, double score, Map<String, Object> metadata) {
        this.docId = docId;
        this.content = content != null ? content : "";
        this.score = Double.isNaN(score) ? 0d : score;
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
    }

    /**
     * Creates a handler-authored message that should be shown to the user as is.
     */
    public static SearchResult directAnswer(String docId, String type, String message) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(META_TYPE, type);
        metadata.put(META_DIRECT_ANSWER, true);
        return new SearchResult(docId, message, 0d, metadata);
    }

    /**
     * Creates a degraded result carrying a localized message and a failure tag.
     * {@link FailureKind#NOT_FOUND} and {@link FailureKind#SECURITY_REJECTION} are
     * expected outcomes and are not flagged as errors.
     */
    public static SearchResult failure(String docId, String type, FailureKind kind, String message) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(META_TYPE, type);
        metadata.put(META_DIRECT_ANSWER, true);
        metadata.put(META_ERROR, kind != FailureKind.NOT_FOUND && kind != FailureKind.SECURITY_REJECTION);
        metadata.put(META_FAILURE, kind.tag());
        return new SearchResult(docId, message, 0d, metadata);
    }

    @JsonIgnore
    public boolean isDirectAnswer() {
        return Boolean.TRUE.equals(metadata.get(META_DIRECT_ANSWER));
    }

    @JsonIgnore
    public boolean isError() {
        return Boolean.TRUE.equals(metadata.get(META_ERROR));
    }

    /**
     * Returns the failure tag, or {@code null} for a normal result.
     */
    @JsonIgnore
    public String getFailure() {
        Object failure = metadata.get(META_FAILURE);
        return failure != null ? failure.toString() : null;
    }

    /**
     * Returns a metadata value as a string, or {@code null} when absent.
     */
    public String metadataText(String key) {
        Object value = metadata.get(key);
        return value != null ? value.toString() : null;
    }
}
