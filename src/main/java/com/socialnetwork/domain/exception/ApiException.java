package com.socialnetwork.domain.exception;

import org.springframework.http.HttpStatus;

/**
 * Base for domain errors that map onto an HTTP status.
 *
 * Services throw the concrete subclasses; the API layer turns them into
 * {@code {"error": ..., "message": ...}} bodies.
 */
public abstract class ApiException extends RuntimeException {

    private final HttpStatus status;

    protected ApiException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
