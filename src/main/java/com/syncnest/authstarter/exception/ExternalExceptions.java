package com.syncnest.authstarter.exception;

import com.syncnest.authstarter.utils.ErrorMessages;
import org.springframework.http.HttpStatus;

/**
 * Typed exceptions for failures caused by external systems (the token store, the database).
 * These extend ApiException so GlobalExceptionHandler will render RFC7807 ProblemDetails.
 *
 * Conventions:
 * - type:    https://syncnest.dev/problems/<slug>
 * - detail:  free-form (safe) message; avoid sensitive payloads
 */
public final class ExternalExceptions {

    private ExternalExceptions() {}

    /** 503 Service Unavailable – A backing store could not complete the operation. */
    public static final class UpstreamUnavailable extends ApiException {
        public UpstreamUnavailable(String detail) {
            super(HttpStatus.SERVICE_UNAVAILABLE,
                    "https://syncnest.dev/problems/upstream-unavailable",
                    "Upstream Unavailable",
                    ErrorMessages.Errors.SERVICE_UNAVAILABLE,
                    detail);
        }

        public UpstreamUnavailable(String detail, Throwable cause) {
            this(detail);
            initCause(cause);
        }
    }
}
