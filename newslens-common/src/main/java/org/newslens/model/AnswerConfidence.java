package org.newslens.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse confidence reported with every answer.
 */
public enum AnswerConfidence {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse; anything unrecognised is {@link #LOW}.
     */
    @JsonCreator
    public static AnswerConfidence fromLabel(String label) {
        if (label == null) {
            return LOW;
        }
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "high" -> HIGH;
            case "medium" -> MEDIUM;
            default -> LOW;
        };
    }
}
