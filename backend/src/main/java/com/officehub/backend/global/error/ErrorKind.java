package com.officehub.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Failure taxonomy of the workflow engine. Each kind maps to one stable HTTP
 * classification so callers can tell "not allowed" from "malformed" from
 * "try again differently".
 */
public enum ErrorKind {
    NOT_FOUND(HttpStatus.NOT_FOUND),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    INVALID_TRANSITION(HttpStatus.BAD_REQUEST),
    INVALID_INTERVAL(HttpStatus.BAD_REQUEST),
    CONFLICT(HttpStatus.CONFLICT);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
