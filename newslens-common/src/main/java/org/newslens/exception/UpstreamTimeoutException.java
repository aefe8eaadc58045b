package org.newslens.exception;

import org.newslens.model.FailureKind;

public class UpstreamTimeoutException extends UpstreamException {

    public UpstreamTimeoutException(String message, Throwable cause) {
        super(FailureKind.UPSTREAM_TIMEOUT, message, cause);
    }
}
