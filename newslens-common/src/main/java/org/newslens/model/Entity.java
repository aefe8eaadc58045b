package org.newslens.model;

import java.util.Objects;

/**
 * Named entity extracted from a question.
 *
 * @param text       entity text as written in the question
 * @param type       entity type
 * @param normalized canonical form, may be {@code null}
 * @param confidence extraction confidence, clamped to {@code [0, 1]}
 */
public record Entity(String text, EntityType type, String normalized, double confidence) {

    public Entity {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(type, "type");
        confidence = Scores.clampUnit(confidence);
    }
}
