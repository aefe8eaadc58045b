package org.newslens.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Intent, entities and keywords extracted from a question.
 *
 * <p>{@code metadata} is a free-form bag. Well-known keys are listed as
 * constants on this type.</p>
 */
public record QueryAnalysis(
        Intent intent,
        List<Entity> entities,
        double confidence,
        List<String> keywords,
        Map<String, Object> metadata
) {

    public static final String META_ORIGINAL_LANGUAGE = "original_language";
    public static final String META_TRANSLATED_TO_PIVOT = "translated_to_pivot";
    public static final String META_REASONING = "reasoning";
    public static final String META_INJECTION_PATTERN = "injection_pattern";
    public static final String META_ERROR = "error";

    public QueryAnalysis {
        intent = intent != null ? intent : Intent.UNKNOWN;
        entities = entities != null ? List.copyOf(entities) : List.of();
        confidence = Scores.clampUnit(confidence);
        keywords = keywords != null ? List.copyOf(keywords) : List.of();
        metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
    }

    /**
     * Returns a copy with a different intent and confidence, keeping everything else.
     */
    public QueryAnalysis withIntent(Intent newIntent, double newConfidence, Map<String, Object> extraMetadata) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        if (extraMetadata != null) {
            merged.putAll(extraMetadata);
        }
        return new QueryAnalysis(newIntent, entities, newConfidence, keywords, merged);
    }
}
