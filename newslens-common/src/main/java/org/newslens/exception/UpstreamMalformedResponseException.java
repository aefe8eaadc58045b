package org.newslens.exception;

import org.newslens.model.FailureKind;

/**
 * The upstream answered, but the payload could not be used (empty, not JSON,
 * rejected SQL).
 */
public class UpstreamMalformedResponseException extends UpstreamException {

    public UpstreamMalformedResponseException(String message) {
        super(FailureKind.UPSTREAM_MALFORMED_RESPONSE, message);
    }

    public UpstreamMalformedResponseException(String message, Throwable cause) {
        super(FailureKind.UPSTREAM_MALFORMED_RESPONSE, message, cause);
    }
}
