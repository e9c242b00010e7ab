package com.syncnest.authstarter.utils;

/**
 * Message keys for localized error details (see {@code messages*.properties}).
 */
public final class ErrorMessages {

    private ErrorMessages() {}

    public static final class Auth {
        private Auth() {}

        public static final String EMAIL_TAKEN = "auth.email_taken";
        public static final String INVALID_CREDENTIALS = "auth.invalid_credentials";
        public static final String INVALID_REFRESH_TOKEN = "auth.invalid_refresh_token";
        public static final String USER_NOT_FOUND = "auth.user_not_found";
        public static final String TOKEN_MISSING = "auth.token_missing";
        public static final String TOKEN_REVOKED = "auth.token_revoked";
        public static final String TOKEN_EXPIRED = "auth.token_expired";
        public static final String INVALID_TOKEN = "auth.invalid_token";
        public static final String BEARER_TOKEN_REQUIRED = "auth.bearer_token_required";
    }

    public static final class Errors {
        private Errors() {}

        public static final String NOT_FOUND = "errors.not_found";
        public static final String USER_NOT_FOUND = "errors.user_not_found";
        public static final String FORBIDDEN = "errors.forbidden";
        public static final String VALIDATION = "errors.validation";
        public static final String BAD_REQUEST = "errors.bad_request";
        public static final String SERVICE_UNAVAILABLE = "errors.service_unavailable";
        public static final String INTERNAL = "errors.internal";
    }
}
