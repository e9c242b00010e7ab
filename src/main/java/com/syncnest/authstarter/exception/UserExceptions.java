package com.syncnest.authstarter.exception;

import com.syncnest.authstarter.utils.ErrorMessages;
import org.springframework.http.HttpStatus;

/**
 * User-domain specific exceptions (registration, profile lookup).
 * Keep authentication failures in {@link AuthExceptions}.
 *
 * Conventions:
 *  - type:  https://syncnest.dev/problems/<slug>
 */
public final class UserExceptions {

    private UserExceptions() {}

    /** 404 Not Found – User record not present. */
    public static final class UserNotFound extends ApiException {
        public UserNotFound(String detail) {
            super(HttpStatus.NOT_FOUND,
                    "https://syncnest.dev/problems/user-not-found",
                    "User Not Found",
                    ErrorMessages.Errors.USER_NOT_FOUND,
                    detail);
        }
    }

    /** 409 Conflict – Email already registered. */
    public static final class EmailTaken extends ApiException {
        public EmailTaken() {
            super(HttpStatus.CONFLICT,
                    "https://syncnest.dev/problems/email-taken",
                    "Email Taken",
                    ErrorMessages.Auth.EMAIL_TAKEN,
                    "Email is already registered.");
        }

        @Override
        public String code() { return "email_taken"; }
    }
}
