package org.newslens.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Final answer produced for one question. Stored as JSON in the response cache.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QAResponse {

    /** Handler tag used for batch items that failed outright. */
    public static final String ERROR_HANDLER = "error";

    String query;
    String language;
    Intent intent;
    String answer;
    @Singular
    List<SourceInfo> sources;
    AnswerConfidence confidence;
    @Singular
    List<String> keyFacts;
    @Singular
    List<SearchResult> searchResults;
    int totalFound;
    String handlerUsed;
}
