package com.syncnest.authstarter.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Lightweight base exception carrying HTTP semantics for RFC 7807 responses.
 * Throw these from services/controllers; GlobalExceptionHandler maps them.
 * <p>
 * {@code messageKey} is resolved against the application's MessageSource for the
 * caller's locale; the exception message is the English fallback.
 */
@Getter
public abstract class ApiException extends RuntimeException {

    private final HttpStatus status;
    private final String type;       // e.g., https://syncnest.dev/problems/not-found
    private final String title;      // short summary for ProblemDetail title
    private final String messageKey; // e.g., auth.invalid_credentials

    protected ApiException(HttpStatus status, String type, String title, String messageKey, String detail) {
        super(detail);
        this.status = status;
        this.type = type;
        this.title = title;
        this.messageKey = messageKey;
    }

    /** Optional machine-readable error code (override if needed). */
    public String code() { return null; }
}
