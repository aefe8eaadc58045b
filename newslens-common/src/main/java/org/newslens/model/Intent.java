package org.newslens.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed classification of what kind of request a question represents.
 *
 * <p>Wire labels are the lowercase constant names. Any label that is not
 * recognised parses to {@link #UNKNOWN}.</p>
 */
public enum Intent {

    /** Who / what / where / when questions about concrete facts. */
    FACTOID,

    /** Counts, rankings and aggregates over the news archive. */
    STATISTICS,

    /** Questions about the future. */
    PREDICTION,

    /** Greetings and small talk. */
    TALK,

    /** Prompt injection or data exfiltration attempts. */
    ATTACKING,

    /** Why / explain questions that need several documents. */
    ANALYTICAL,

    UNKNOWN;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Intent fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return UNKNOWN;
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        if ("STATISTICAL".equals(normalized)) {
            return STATISTICS;
        }
        for (Intent intent : values()) {
            if (intent.name().equals(normalized)) {
                return intent;
            }
        }
        return UNKNOWN;
    }
}
