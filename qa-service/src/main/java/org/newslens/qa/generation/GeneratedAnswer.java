package org.newslens.qa.generation;

import org.newslens.model.AnswerConfidence;
import org.newslens.model.SourceInfo;

import java.util.List;

/**
 * Output of answer generation.
 *
 * @param degraded {@code true} when the answer is an error message rather than
 *                 a real answer; degraded answers are not cached
 */
public record GeneratedAnswer(
        String answer,
        List<SourceInfo> sources,
        AnswerConfidence confidence,
        List<String> keyFacts,
        boolean degraded
) {

    public GeneratedAnswer {
        sources = sources != null ? List.copyOf(sources) : List.of();
        keyFacts = keyFacts != null ? List.copyOf(keyFacts) : List.of();
        confidence = confidence != null ? confidence : AnswerConfidence.LOW;
    }
}
