package com.syncnest.authstarter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Raw token configuration bound from {@code token.*}.
 * Converted once into {@link TokenSettings} at start-up; nothing else reads this class.
 */
@Data
@ConfigurationProperties(prefix = "token")
public class TokenProperties {

    /** HMAC secret for access tokens; at least 32 bytes (UTF-8). */
    private String accessSecret;

    /** Access token lifetime, e.g. {@code 3600s}, {@code 15m}. */
    private String accessExpiresIn = "3600s";

    /** Refresh token lifetime, e.g. {@code 7d}. */
    private String refreshExpiresIn = "7d";

    /** Optional {@code iss} claim; enforced on verify when set. */
    private String issuer;

    /** When the blacklist cannot be read, let the request through (true) or reject it (false). */
    private boolean blacklistFailOpen = true;

    /** Random bytes behind each opaque refresh token (Base64URL encoded). */
    private int refreshTokenBytes = 32;
}
