package org.newslens.model;

import java.util.Objects;

/**
 * Question text after understanding.
 *
 * @param original  raw text as received
 * @param cleaned   lowercased, trimmed, whitespace collapsed
 * @param corrected grammar-normalized text in the retrieval pivot language
 * @param language  language code of the original question
 */
public record ProcessedQuery(String original, String cleaned, String corrected, String language) {

    public ProcessedQuery {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(cleaned, "cleaned");
        Objects.requireNonNull(corrected, "corrected");
        Objects.requireNonNull(language, "language");
    }
}
