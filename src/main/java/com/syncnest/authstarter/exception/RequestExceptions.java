package com.syncnest.authstarter.exception;

import org.springframework.http.HttpStatus;

/**
 * Exceptions representing problems with the incoming client request itself.
 *
 * Conventions:
 *  - type:  https://syncnest.dev/problems/<slug>
 *  - detail: safe, non-sensitive explanation suitable for clients
 */
public final class RequestExceptions {

    private RequestExceptions() {}

    /** 400 Bad Request – Required header is missing or not in the expected form. */
    public static final class InvalidHeader extends ApiException {
        public InvalidHeader(String messageKey, String detail) {
            super(HttpStatus.BAD_REQUEST,
                    "https://syncnest.dev/problems/invalid-header",
                    "Invalid Header",
                    messageKey,
                    detail);
        }
    }
}
