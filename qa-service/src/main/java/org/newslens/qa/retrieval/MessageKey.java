package org.newslens.qa.retrieval;

/**
 * Templates of the localized handler message catalogue.
 */
public enum MessageKey {
    TALK,
    ATTACKING,
    PREDICTION,
    NO_RESULTS,
    STATISTICS_ERROR,
    SEARCH_ERROR,
    GENERATION_ERROR,
    NO_INFORMATION,
    UNSAFE_QUERY,
    PIPELINE_ERROR
}
