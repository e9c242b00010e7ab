package com.syncnest.authstarter.config;

import com.syncnest.authstarter.utils.ExpiryDurations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

/**
 * Validated, immutable token configuration. Durations are parsed exactly once here.
 */
public record TokenSettings(
        String accessSecret,
        long accessTokenSeconds,
        long refreshTokenSeconds,
        String issuer,
        boolean blacklistFailOpen,
        int refreshTokenBytes
) {

    private static final Logger log = LoggerFactory.getLogger(TokenSettings.class);

    private static final int MIN_SECRET_BYTES = 32;
    private static final int MIN_REFRESH_BYTES = 16;
    private static final Set<String> WEAK_SECRETS = Set.of("change_me", "changeme", "secret", "password", "admin");

    public TokenSettings {
        if (accessSecret == null || accessSecret.isBlank()) {
            throw new IllegalStateException("token.access-secret must be provided.");
        }
        if (accessSecret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("token.access-secret too short for HS256. Provide >= 32 bytes.");
        }
        if (accessTokenSeconds <= 0) {
            throw new IllegalStateException("token.access-expires-in must be positive.");
        }
        if (refreshTokenSeconds <= 0) {
            throw new IllegalStateException("token.refresh-expires-in must be positive.");
        }
        if (refreshTokenBytes < MIN_REFRESH_BYTES) {
            throw new IllegalStateException("token.refresh-token-bytes must be >= " + MIN_REFRESH_BYTES + ".");
        }
        issuer = (issuer == null || issuer.isBlank()) ? null : issuer.trim();
    }

    public static TokenSettings from(TokenProperties props) {
        TokenSettings settings = new TokenSettings(
                props.getAccessSecret(),
                ExpiryDurations.toSeconds(props.getAccessExpiresIn()),
                ExpiryDurations.toSeconds(props.getRefreshExpiresIn()),
                props.getIssuer(),
                props.isBlacklistFailOpen(),
                props.getRefreshTokenBytes()
        );
        if (WEAK_SECRETS.stream().anyMatch(w -> settings.accessSecret().toLowerCase(Locale.ROOT).contains(w))) {
            log.warn("token.access-secret looks like a placeholder; set JWT_ACCESS_SECRET before deploying.");
        }
        if (!settings.blacklistFailOpen()) {
            log.info("Blacklist checks fail closed: a store outage rejects authenticated requests.");
        }
        log.info("Token lifetimes: access={}s, refresh={} day(s)",
                settings.accessTokenSeconds(), ExpiryDurations.toDays(props.getRefreshExpiresIn()));
        return settings;
    }

    @Override
    public String toString() {
        // keep the secret out of logs
        return "TokenSettings[accessTokenSeconds=" + accessTokenSeconds
                + ", refreshTokenSeconds=" + refreshTokenSeconds
                + ", issuer=" + issuer
                + ", blacklistFailOpen=" + blacklistFailOpen + "]";
    }
}
