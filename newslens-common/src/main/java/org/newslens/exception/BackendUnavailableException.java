package org.newslens.exception;

import org.newslens.model.FailureKind;

public class BackendUnavailableException extends UpstreamException {

    public BackendUnavailableException(String message, Throwable cause) {
        super(FailureKind.BACKEND_UNAVAILABLE, message, cause);
    }
}
