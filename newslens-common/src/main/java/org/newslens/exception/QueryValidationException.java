package org.newslens.exception;

/**
 * Raised when a question is missing or blank. This is the only failure that
 * leaves the question answering pipeline as an exception.
 */
public class QueryValidationException extends IllegalArgumentException {

    public QueryValidationException(String message) {
        super(message);
    }
}
