package com.expensesnap.core.exception;

import org.springframework.http.HttpStatus;

/**
 * Stable error kinds surfaced to callers, each bound to the HTTP status class the
 * presentation layer expects.
 */
public enum ErrorKind {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED),
    ACCESS_DENIED(HttpStatus.FORBIDDEN),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    CONVERSION_FAILED(HttpStatus.BAD_REQUEST),
    DOCUMENT_UNREADABLE(HttpStatus.BAD_REQUEST),
    EXTRACTION_UNAVAILABLE(HttpStatus.INTERNAL_SERVER_ERROR),
    EXTRACTION_PARSE_FAILED(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
