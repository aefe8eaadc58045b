package org.newslens.model;

import java.util.Locale;

/**
 * Typed reason attached to a degraded retrieval or generation result.
 */
public enum FailureKind {
    UPSTREAM_TIMEOUT,
    UPSTREAM_MALFORMED_RESPONSE,
    BACKEND_UNAVAILABLE,
    NOT_FOUND,
    SECURITY_REJECTION,
    UNSAFE_SQL;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
