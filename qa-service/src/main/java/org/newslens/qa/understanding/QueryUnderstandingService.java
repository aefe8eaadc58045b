package org.newslens.qa.understanding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.newslens.client.CompletionClient;
import org.newslens.exception.QueryValidationException;
import org.newslens.exception.UpstreamException;
import org.newslens.exception.UpstreamMalformedResponseException;
import org.newslens.model.Entity;
import org.newslens.model.EntityType;
import org.newslens.model.Intent;
import org.newslens.model.ProcessedQuery;
import org.newslens.model.QueryAnalysis;
import org.newslens.qa.config.QaProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a raw question into a {@link ProcessedQuery} and a {@link QueryAnalysis}.
 *
 * <p>One completion call per question does language detection, pivot translation,
 * correction, entity extraction and intent classification. The model output is
 * treated as untrusted: the first balanced JSON object is extracted, fields of the
 * wrong type are ignored, malformed entities are dropped one by one, and any
 * upstream failure degrades to a local fallback analysis.</p>
 *
 * <p>The local {@link PromptInjectionDetector} runs on the raw text afterwards and
 * forces {@link Intent#ATTACKING} when it matches, so the model's classification is
 * never the only security boundary.</p>
 */
@Slf4j
@Service
public class QueryUnderstandingService {

    private final CompletionClient completionClient;
    private final PromptInjectionDetector injectionDetector;
    private final ObjectMapper objectMapper;
    private final String systemPrompt;

    public QueryUnderstandingService(CompletionClient completionClient,
                                     PromptInjectionDetector injectionDetector,
                                     ObjectMapper objectMapper,
                                     QaProperties properties) {
        this.completionClient = completionClient;
        this.injectionDetector = injectionDetector;
        this.objectMapper = objectMapper;
        this.systemPrompt = UnderstandingPrompts.SYSTEM.formatted(properties.getPivotLanguage());
    }

    /**
     * Understands a question.
     *
     * @param rawQuery question as typed by the user
     * @return processed text and analysis, never {@code null}
     * @throws QueryValidationException if the question is null or blank
     */
    public UnderstoodQuery understand(String rawQuery) {
        if (rawQuery == null || rawQuery.isBlank()) {
            throw new QueryValidationException("Query must not be empty");
        }

        UnderstoodQuery understood;
        try {
            String output = completionClient.complete(systemPrompt, UnderstandingPrompts.USER.formatted(rawQuery), true);
            understood = parse(rawQuery, output);
            log.info("Query understood: language={}, intent={}, confidence={}, entities={}",
                    understood.processed().language(), understood.analysis().intent(),
                    understood.analysis().confidence(), understood.analysis().entities().size());
        } catch (UpstreamException e) {
            log.warn("Query understanding degraded to fallback ({}): {}", e.getFailureKind().tag(), e.getMessage());
            understood = fallback(rawQuery, e.getFailureKind().tag() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected query understanding failure: {}", e.getMessage(), e);
            understood = fallback(rawQuery, e.getMessage());
        }

        return applyInjectionGuard(rawQuery, understood);
    }

    /**
     * Analysis used when the model could not be reached or its answer was unusable.
     */
    static UnderstoodQuery fallback(String rawQuery, String error) {
        String cleaned = QueryTextCleaner.clean(rawQuery);
        String language = LanguageGuesser.guess(rawQuery);
        ProcessedQuery processed = new ProcessedQuery(rawQuery, cleaned, cleaned, language);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(QueryAnalysis.META_ORIGINAL_LANGUAGE, language);
        metadata.put(QueryAnalysis.META_ERROR, error);

        QueryAnalysis analysis = new QueryAnalysis(Intent.UNKNOWN, List.of(), 0d, whitespaceSplit(cleaned), metadata);
        return new UnderstoodQuery(processed, analysis);
    }

    // ---------------------------------------------------------------
    // Parsing
    // ---------------------------------------------------------------

    private UnderstoodQuery parse(String rawQuery, String output) {
        String json = JsonObjectExtractor.extractFirst(output)
                .orElseThrow(() -> new UpstreamMalformedResponseException("No JSON object in understanding output"));

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new UpstreamMalformedResponseException("Understanding output is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new UpstreamMalformedResponseException("Understanding output is not a JSON object");
        }

        String localClean = QueryTextCleaner.clean(rawQuery);
        String modelCleaned = text(root, "cleaned").map(QueryTextCleaner::clean).filter(s -> !s.isEmpty()).orElse(null);
        String translated = text(root, "translated_to_pivot").orElse(null);
        String cleaned = modelCleaned != null ? modelCleaned : localClean;
        String corrected = text(root, "corrected")
                .or(() -> Optional.ofNullable(translated))
                .or(() -> Optional.ofNullable(modelCleaned))
                .orElse(localClean);
        String language = text(root, "original_language")
                .map(l -> l.toLowerCase(Locale.ROOT))
                .orElseGet(() -> LanguageGuesser.guess(rawQuery));

        ProcessedQuery processed = new ProcessedQuery(rawQuery, cleaned, corrected, language);

        Intent intent = Intent.fromLabel(text(root, "intent").orElse(null));
        double confidence = number(root.get("confidence"));
        List<Entity> entities = entities(root.get("entities"));
        List<String> keywords = keywords(root.get("keywords"));
        if (keywords.isEmpty() && !root.has("keywords")) {
            keywords = whitespaceSplit(cleaned);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(QueryAnalysis.META_ORIGINAL_LANGUAGE, language);
        metadata.put(QueryAnalysis.META_TRANSLATED_TO_PIVOT, translated != null ? translated : corrected);
        text(root, "reasoning").ifPresent(r -> metadata.put(QueryAnalysis.META_REASONING, r));

        log.debug("Understanding output parsed: corrected=\"{}\", keywords={}", corrected, keywords);
        return new UnderstoodQuery(processed, new QueryAnalysis(intent, entities, confidence, keywords, metadata));
    }

    private List<Entity> entities(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<Entity> entities = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isObject()) {
                log.debug("Dropping non-object entity: {}", item);
                continue;
            }
            Optional<String> text = text(item, "text");
            Optional<EntityType> type = text(item, "type").flatMap(EntityType::fromLabel);
            if (text.isEmpty() || type.isEmpty()) {
                log.debug("Dropping malformed entity: {}", item);
                continue;
            }
            entities.add(new Entity(text.get(), type.get(), text(item, "normalized").orElse(null),
                    number(item.get("confidence"))));
        }
        return entities;
    }

    private static List<String> keywords(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> keywords = new ArrayList<>();
        for (JsonNode item : node) {
            if (item.isTextual() && !item.asText().isBlank()) {
                keywords.add(item.asText().trim());
            }
        }
        return keywords;
    }

    private static Optional<String> text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isValueNode() || value.isNull()) {
            return Optional.empty();
        }
        String text = value.asText().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    private static double number(JsonNode value) {
        if (value == null) {
            return 0d;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return 0d;
            }
        }
        return 0d;
    }

    private static List<String> whitespaceSplit(String cleaned) {
        if (cleaned.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(cleaned.split(" "));
    }

    // ---------------------------------------------------------------
    // Security
    // ---------------------------------------------------------------

    private UnderstoodQuery applyInjectionGuard(String rawQuery, UnderstoodQuery understood) {
        Optional<String> pattern = injectionDetector.detect(rawQuery);
        if (pattern.isEmpty()) {
            return understood;
        }
        log.warn("SECURITY: injection pattern matched, forcing attacking intent (model said {})",
                understood.analysis().intent());
        QueryAnalysis forced = understood.analysis()
                .withIntent(Intent.ATTACKING, 1d, Map.of(QueryAnalysis.META_INJECTION_PATTERN, pattern.get()));
        return new UnderstoodQuery(understood.processed(), forced);
    }
}
