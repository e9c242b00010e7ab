package com.syncnest.authstarter.exception;

import com.syncnest.authstarter.utils.ErrorMessages;
import org.springframework.http.HttpStatus;

/**
 * Authentication failures raised by login, refresh and the per-request bearer check.
 * Every one of these is a 401; {@link #code()} tells the client which case it hit.
 *
 * Conventions:
 *  - type:  https://syncnest.dev/problems/<slug>
 *  - code:  snake_case, stable across releases
 */
public final class AuthExceptions {

    private AuthExceptions() {}

    private abstract static class Unauthorized extends ApiException {
        private final String code;

        Unauthorized(String slug, String title, String messageKey, String detail, String code) {
            super(HttpStatus.UNAUTHORIZED,
                    "https://syncnest.dev/problems/" + slug,
                    title,
                    messageKey,
                    detail);
            this.code = code;
        }

        @Override
        public String code() { return code; }
    }

    /** Unknown email or wrong password. Both cases read the same to the caller. */
    public static final class InvalidCredentials extends Unauthorized {
        public InvalidCredentials() {
            super("invalid-credentials", "Invalid Credentials",
                    ErrorMessages.Auth.INVALID_CREDENTIALS,
                    "Invalid email or password.", "invalid_credentials");
        }
    }

    /** Refresh token unknown, expired, already used, or revoked. */
    public static final class InvalidRefreshToken extends Unauthorized {
        public InvalidRefreshToken() {
            super("invalid-refresh-token", "Invalid Refresh Token",
                    ErrorMessages.Auth.INVALID_REFRESH_TOKEN,
                    "Refresh token is invalid or expired.", "invalid_refresh_token");
        }
    }

    /** No bearer credential on a protected request. */
    public static final class TokenMissing extends Unauthorized {
        public TokenMissing() {
            super("token-missing", "Token Missing",
                    ErrorMessages.Auth.TOKEN_MISSING,
                    "Access token is missing.", "token_missing");
        }
    }

    public static final class TokenRevoked extends Unauthorized {
        public TokenRevoked() {
            super("token-revoked", "Token Revoked",
                    ErrorMessages.Auth.TOKEN_REVOKED,
                    "Access token has been revoked.", "token_revoked");
        }
    }

    public static final class TokenExpired extends Unauthorized {
        public TokenExpired() {
            super("token-expired", "Token Expired",
                    ErrorMessages.Auth.TOKEN_EXPIRED,
                    "Access token has expired.", "token_expired");
        }
    }

    /** Bad signature, malformed token, wrong issuer or missing claims. */
    public static final class InvalidToken extends Unauthorized {
        public InvalidToken() {
            super("invalid-token", "Invalid Token",
                    ErrorMessages.Auth.INVALID_TOKEN,
                    "Access token is invalid.", "invalid_token");
        }
    }

    /** Token is valid but its subject no longer exists. */
    public static final class UserNotFound extends Unauthorized {
        public UserNotFound() {
            super("user-not-found", "User Not Found",
                    ErrorMessages.Auth.USER_NOT_FOUND,
                    "User not found.", "user_not_found");
        }
    }
}
