package com.syncnest.authstarter.SecurityConfig;

import com.syncnest.authstarter.config.TokenSettings;
import com.syncnest.authstarter.exception.AuthExceptions;
import com.syncnest.authstarter.store.KeyValueStore;
import com.syncnest.authstarter.store.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Revoked access tokens, kept only until the verifier would reject the token as expired anyway.
 * <p>
 * {@link #isBlacklisted} fails open on store errors by default: a Redis outage must not
 * lock every signed-in user out, and signature/expiry checks still run. Set
 * {@code token.blacklist-fail-open=false} to reject instead.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenBlacklistService {

    private static final String KEY_PREFIX = "blacklist:";
    private static final String MARKER = "1";

    private final KeyValueStore store;
    private final JwtTokenProvider tokenProvider;
    private final TokenSettings settings;
    private final Clock clock;

    /**
     * Blacklist a token for as long as the verifier would still accept it, or for the full
     * access lifetime if the expiry cannot be read. Never throws: logout must complete even if this fails.
     */
    public void add(@NonNull String accessToken) {
        if (accessToken.isBlank()) {
            log.debug("Blacklist skip: blank token");
            return;
        }
        Duration ttl = ttlFor(accessToken);
        try {
            store.set(KEY_PREFIX + accessToken, MARKER, ttl);
        } catch (StoreUnavailableException e) {
            log.warn("Token store unavailable while blacklisting token: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Unexpected error while blacklisting token", e);
        }
    }

    /** Existence check against the store. Never cached. */
    public boolean isBlacklisted(@NonNull String accessToken) {
        if (accessToken.isBlank()) return false;
        try {
            return store.exists(KEY_PREFIX + accessToken);
        } catch (StoreUnavailableException e) {
            if (settings.blacklistFailOpen()) {
                log.warn("Token store unavailable during blacklist check; failing open");
                return false;
            }
            log.warn("Token store unavailable during blacklist check; failing closed");
            return true;
        }
    }

    /**
     * Remaining acceptance window of the token: until {@code exp} plus the verifier's clock
     * skew, plus one second because the verifier still accepts a token at exactly that instant.
     * Whole seconds, rounded up.
     */
    Duration ttlFor(String accessToken) {
        Duration fallback = Duration.ofSeconds(settings.accessTokenSeconds());
        Instant expiresAt;
        try {
            expiresAt = tokenProvider.decode(accessToken).expiresAt();
        } catch (AuthExceptions.InvalidToken e) {
            log.debug("Blacklist: unreadable token, using default lifetime");
            return fallback;
        }
        if (expiresAt == null) {
            return fallback;
        }
        Instant acceptedUntil = expiresAt.plus(tokenProvider.getClockSkew()).plusSeconds(1);
        Duration remaining = Duration.between(clock.instant(), acceptedUntil);
        if (remaining.isZero() || remaining.isNegative()) {
            return fallback;
        }
        long seconds = remaining.getSeconds() + (remaining.getNano() > 0 ? 1 : 0);
        return Duration.ofSeconds(seconds);
    }
}
