package com.syncnest.authstarter.serviceImpl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncnest.authstarter.config.TokenSettings;
import com.syncnest.authstarter.dto.ClientMetadata;
import com.syncnest.authstarter.entity.UserRole;
import com.syncnest.authstarter.model.RefreshTokenRecord;
import com.syncnest.authstarter.service.RefreshTokenService;
import com.syncnest.authstarter.store.KeyValueStore;
import com.syncnest.authstarter.store.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Refresh tokens in Redis:
 * - {@code refresh:<token>} holds the JSON record, TTL = time left until its absolute expiry.
 * - {@code user:refresh_tokens:<userId>} is a set of the user's outstanding tokens, used only
 *   to enumerate them for revoke-all. Its TTL follows the newest member. Members whose
 *   record could not be deleted stay in it so a later revoke-all can retry them.
 * Tokens are 256-bit (configurable) random values, Base64URL without padding.
 * Raw tokens are never logged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefreshTokenServiceImpl implements RefreshTokenService {

    private static final String TOKEN_PREFIX = "refresh:";
    private static final String USER_INDEX_PREFIX = "user:refresh_tokens:";

    private static final SecureRandom RANDOM = new SecureRandom();

    private final KeyValueStore store;
    private final TokenSettings settings;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    // ============================== API ==============================

    @Override
    public String issue(long userId, UserRole role, ClientMetadata metadata) {
        ClientMetadata meta = metadata != null ? metadata : ClientMetadata.empty();
        long now = clock.instant().getEpochSecond();
        long lifetime = settings.refreshTokenSeconds();

        String token = generateRawToken();
        RefreshTokenRecord record = new RefreshTokenRecord(
                userId, role.name(), now + lifetime, now, meta.getIpAddress(), meta.getUserAgent());

        Duration ttl = Duration.ofSeconds(lifetime);
        store.set(tokenKey(token), serialize(record), ttl);
        store.addToSet(userIndexKey(userId), token, ttl);

        log.debug("Issued refresh token for user {}", userId);
        return token;
    }

    @Override
    public Optional<RefreshTokenRecord> verify(String token) {
        if (isBlank(token)) return Optional.empty();
        try {
            Optional<RefreshTokenRecord> found = store.get(tokenKey(token)).flatMap(this::deserialize);
            if (found.isEmpty()) {
                return Optional.empty();
            }
            RefreshTokenRecord record = found.get();
            if (record.isExpiredAt(clock.instant().getEpochSecond())) {
                // store TTL and embedded expiry disagree; the embedded one wins
                log.debug("Refresh token for user {} past its expiry; deleting", record.userId());
                store.delete(tokenKey(token));
                store.removeFromSet(userIndexKey(record.userId()), token);
                return Optional.empty();
            }
            return found;
        } catch (StoreUnavailableException e) {
            log.warn("Token store unavailable while verifying refresh token; treating as invalid: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<RefreshTokenRecord> consume(String token) {
        if (isBlank(token)) return Optional.empty();
        final Optional<RefreshTokenRecord> taken;
        try {
            taken = store.getAndDelete(tokenKey(token)).flatMap(this::deserialize);
        } catch (StoreUnavailableException e) {
            log.warn("Token store unavailable while consuming refresh token; treating as invalid: {}", e.getMessage());
            return Optional.empty();
        }
        if (taken.isEmpty()) {
            return Optional.empty();
        }
        RefreshTokenRecord record = taken.get();
        unindexQuietly(record.userId(), token);
        if (record.isExpiredAt(clock.instant().getEpochSecond())) {
            return Optional.empty();
        }
        return taken;
    }

    @Override
    public void revoke(String token) {
        if (isBlank(token)) return;
        store.getAndDelete(tokenKey(token))
                .flatMap(this::deserialize)
                .ifPresent(record -> {
                    store.removeFromSet(userIndexKey(record.userId()), token);
                    log.debug("Revoked refresh token for user {}", record.userId());
                });
    }

    @Override
    public int revokeAll(long userId) {
        String indexKey = userIndexKey(userId);
        final Set<String> tokens;
        try {
            tokens = store.members(indexKey);
        } catch (StoreUnavailableException e) {
            log.error("Cannot read refresh token index for user {}; nothing revoked: {}", userId, e.getMessage());
            return 0;
        }

        int revoked = 0;
        List<String> gone = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            try {
                if (store.delete(tokenKey(token))) {
                    revoked++;
                }
                gone.add(token);
            } catch (StoreUnavailableException e) {
                log.warn("Failed to revoke one refresh token of user {}: {}", userId, e.getMessage());
            }
        }
        int failed = tokens.size() - gone.size();

        // the index is the only way to find a stuck token again, so it goes only once it is empty
        try {
            if (failed == 0) {
                store.delete(indexKey);
            } else {
                for (String token : gone) {
                    store.removeFromSet(indexKey, token);
                }
            }
        } catch (StoreUnavailableException e) {
            log.warn("Failed to update refresh token index of user {}: {}", userId, e.getMessage());
        }

        if (failed > 0) {
            log.error("Revoke-all for user {} incomplete: {} revoked, {} failed and kept in the index for a retry",
                    userId, revoked, failed);
        } else {
            log.info("Revoked {} refresh token(s) for user {}", revoked, userId);
        }
        return revoked;
    }

    // ============================== helpers ==============================

    private String generateRawToken() {
        byte[] buf = new byte[settings.refreshTokenBytes()];
        RANDOM.nextBytes(buf);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(buf);
    }

    private void unindexQuietly(long userId, String token) {
        try {
            store.removeFromSet(userIndexKey(userId), token);
        } catch (StoreUnavailableException e) {
            // the record is already gone; a stale index member only costs a no-op delete later
            log.debug("Could not drop consumed token from index of user {}: {}", userId, e.getMessage());
        }
    }

    private String serialize(RefreshTokenRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize refresh token record", e);
        }
    }

    private Optional<RefreshTokenRecord> deserialize(String json) {
        try {
            return Optional.of(objectMapper.readValue(json, RefreshTokenRecord.class));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable refresh token record; treating as invalid: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static String tokenKey(String token) {
        return TOKEN_PREFIX + token;
    }

    private static String userIndexKey(long userId) {
        return USER_INDEX_PREFIX + userId;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
