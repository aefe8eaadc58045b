package org.newslens.qa.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.newslens.client.CompletionClient;
import org.newslens.exception.UpstreamException;
import org.newslens.exception.UpstreamMalformedResponseException;
import org.newslens.model.AnswerConfidence;
import org.newslens.model.SearchResult;
import org.newslens.model.SourceInfo;
import org.newslens.qa.retrieval.HandlerMessages;
import org.newslens.qa.retrieval.MessageKey;
import org.newslens.qa.understanding.JsonObjectExtractor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Writes the final answer from retrieved evidence.
 *
 * <ul>
 *   <li>No evidence: a fixed "no information" message, without calling the model.</li>
 *   <li>Only handler messages (greeting, warning, no results, errors): the messages are
 *       returned as they are, without calling the model.</li>
 *   <li>Otherwise the evidence is rendered into a numbered context block and the model
 *       answers as JSON in the caller's language. Cited ids are resolved against the
 *       evidence to recover canonical source names and URLs.</li>
 * </ul>
 *
 * <p>Model failures produce a localized error answer with {@code degraded = true}.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnswerGenerator {

    private static final String SEPARATOR = "=".repeat(80);
    private static final String UNKNOWN_SOURCE = "Unknown";
    private static final String NOT_AVAILABLE = "N/A";

    private final CompletionClient completionClient;
    private final HandlerMessages messages;
    private final ObjectMapper objectMapper;

    public GeneratedAnswer generate(String query, List<SearchResult> searchResults, String language) {
        if (searchResults == null || searchResults.isEmpty()) {
            log.info("No evidence, answering without the model");
            return new GeneratedAnswer(messages.get(MessageKey.NO_INFORMATION, language),
                    List.of(), AnswerConfidence.LOW, List.of(), false);
        }

        if (searchResults.stream().allMatch(SearchResult::isDirectAnswer)) {
            return directAnswer(searchResults);
        }

        String userPrompt = GenerationPrompts.USER.formatted(query, language, formatContext(searchResults));
        log.debug("Generation context: {} results, prompt length={} chars", searchResults.size(), userPrompt.length());

        try {
            String output = completionClient.complete(GenerationPrompts.SYSTEM, userPrompt, true);
            GeneratedAnswer answer = parse(output, searchResults);
            log.info("Answer generated: confidence={}, sources={}, keyFacts={}",
                    answer.confidence().label(), answer.sources().size(), answer.keyFacts().size());
            return answer;
        } catch (UpstreamException e) {
            log.warn("Answer generation degraded ({}): {}", e.getFailureKind().tag(), e.getMessage());
            return errorAnswer(language);
        } catch (RuntimeException e) {
            log.error("Answer generation failed: {}", e.getMessage(), e);
            return errorAnswer(language);
        }
    }

    private GeneratedAnswer errorAnswer(String language) {
        return new GeneratedAnswer(messages.get(MessageKey.GENERATION_ERROR, language),
                List.of(), AnswerConfidence.LOW, List.of(), true);
    }

    private GeneratedAnswer directAnswer(List<SearchResult> searchResults) {
        String answer = searchResults.stream()
                .map(SearchResult::getContent)
                .collect(Collectors.joining("\n\n"));
        boolean failed = searchResults.stream().anyMatch(r -> r.getFailure() != null);
        boolean degraded = searchResults.stream().anyMatch(SearchResult::isError);
        log.info("Returning handler message without the model (failed={})", failed);
        return new GeneratedAnswer(answer, List.of(), failed ? AnswerConfidence.LOW : AnswerConfidence.HIGH,
                List.of(), degraded);
    }

    // ---------------------------------------------------------------
    // Context
    // ---------------------------------------------------------------

    /**
     * Renders results in a fixed field order: index, id, source, url, category,
     * importance, date, relevance with three decimals, content.
     */
    static String formatContext(List<SearchResult> results) {
        List<String> parts = new ArrayList<>(results.size());
        int index = 1;
        for (SearchResult result : results) {
            parts.add(String.format(Locale.ROOT,
                    "[NEWS #%d]\nID: %s\nSource: %s\nURL: %s\nCategory: %s\nImportance: %s\nDate: %s\nRelevance: %.3f\n\nCONTENT:\n%s\n",
                    index++,
                    result.getDocId(),
                    orDefault(result.metadataText(SearchResult.META_SOURCE), UNKNOWN_SOURCE),
                    orDefault(result.metadataText(SearchResult.META_URL), NOT_AVAILABLE),
                    orDefault(result.metadataText(SearchResult.META_CATEGORY), NOT_AVAILABLE),
                    orDefault(result.metadataText(SearchResult.META_IMPORTANCE), NOT_AVAILABLE),
                    orDefault(result.metadataText(SearchResult.META_DATE), NOT_AVAILABLE),
                    result.getScore(),
                    result.getContent()));
        }
        return SEPARATOR + "\n" + String.join(SEPARATOR + "\n", parts);
    }

    private static String orDefault(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }

    // ---------------------------------------------------------------
    // Parsing
    // ---------------------------------------------------------------

    private GeneratedAnswer parse(String output, List<SearchResult> searchResults) {
        String json = JsonObjectExtractor.extractFirst(output)
                .orElseThrow(() -> new UpstreamMalformedResponseException("No JSON object in generation output"));
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new UpstreamMalformedResponseException("Generation output is not valid JSON", e);
        }

        JsonNode answerNode = root.get("answer");
        if (answerNode == null || !answerNode.isTextual() || answerNode.asText().isBlank()) {
            throw new UpstreamMalformedResponseException("Generation output has no answer");
        }

        JsonNode confidenceNode = root.get("confidence");
        AnswerConfidence confidence = AnswerConfidence.fromLabel(
                confidenceNode != null && confidenceNode.isTextual() ? confidenceNode.asText() : null);

        List<String> keyFacts = new ArrayList<>();
        JsonNode factsNode = root.get("key_facts");
        if (factsNode != null && factsNode.isArray()) {
            for (JsonNode fact : factsNode) {
                if (fact.isTextual() && !fact.asText().isBlank()) {
                    keyFacts.add(fact.asText().trim());
                }
            }
        }

        return new GeneratedAnswer(answerNode.asText().trim(), resolveSources(root.get("sources"), searchResults),
                confidence, keyFacts, false);
    }

    /**
     * Resolves cited ids against the evidence. Values given by the model win; missing
     * ones are filled from the result metadata. Unresolved citations are kept with the
     * model's name (or {@code Unknown}) and URL. Repeated ids collapse to the first.
     */
    static List<SourceInfo> resolveSources(JsonNode sourcesNode, List<SearchResult> searchResults) {
        if (sourcesNode == null || !sourcesNode.isArray()) {
            return List.of();
        }
        Map<String, SearchResult> byId = searchResults.stream()
                .filter(r -> r.getDocId() != null)
                .collect(Collectors.toMap(SearchResult::getDocId, Function.identity(), (a, b) -> a));

        Map<String, SourceInfo> sources = new LinkedHashMap<>();
        for (JsonNode node : sourcesNode) {
            if (!node.isObject()) {
                continue;
            }
            String id = text(node, "id");
            String name = text(node, "name");
            String url = text(node, "url");
            if (id == null && name == null) {
                continue;
            }
            String key = id != null ? id : "";
            if (sources.containsKey(key)) {
                continue;
            }

            SearchResult result = id != null ? byId.get(id) : null;
            if (result != null) {
                sources.put(key, new SourceInfo(id,
                        name != null ? name : orDefault(result.metadataText(SearchResult.META_SOURCE), UNKNOWN_SOURCE),
                        url != null ? url : result.metadataText(SearchResult.META_URL)));
            } else {
                sources.put(key, new SourceInfo(key, name != null ? name : UNKNOWN_SOURCE, url));
            }
        }
        return new ArrayList<>(sources.values());
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
