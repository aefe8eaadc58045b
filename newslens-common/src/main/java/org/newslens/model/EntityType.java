package org.newslens.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of named entity types extracted from questions.
 */
public enum EntityType {
    PERSON,
    ORGANIZATION,
    LOCATION,
    DATE,
    MONEY,
    NUMBER,
    EVENT,
    DOCUMENT,
    OTHER;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire label. Unlike {@link Intent#fromLabel(String)} there is no
     * catch-all: an unknown type makes the whole entity invalid.
     */
    public static Optional<EntityType> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        for (EntityType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
