package org.newslens.exception;

import org.newslens.model.FailureKind;

/**
 * Base class for failures of an upstream collaborator (completion model,
 * vector store, relational store).
 */
public class UpstreamException extends RuntimeException {

    private final FailureKind failureKind;

    public UpstreamException(FailureKind failureKind, String message) {
        super(message);
        this.failureKind = failureKind;
    }

    public UpstreamException(FailureKind failureKind, String message, Throwable cause) {
        super(message, cause);
        this.failureKind = failureKind;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    /**
     * Maps any throwable to the failure kind a stage should report for it.
     */
    public static FailureKind kindOf(Throwable t) {
        if (t instanceof UpstreamException upstream) {
            return upstream.getFailureKind();
        }
        return FailureKind.BACKEND_UNAVAILABLE;
    }
}
