package org.newslens.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Retrieval algorithm selected for a question.
 */
public enum RetrievalStrategy {
    SIMPLE_SEARCH,
    STATISTICS_QUERY,
    PREDICTION_QUERY,
    STATIC_RESPONSE,
    REJECT,
    HYBRID_SEARCH;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
