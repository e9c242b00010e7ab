package com.syncnest.authstarter.store;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Minimal key-value contract the token components need. Every method is a single
 * round trip (two for {@link #addToSet}) and throws
 * {@link StoreUnavailableException} once the retry policy is exhausted.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    /** SET with expiry. {@code ttl} must be positive. */
    void set(String key, String value, Duration ttl);

    /** Atomic delete-and-return-previous-value (GETDEL). */
    Optional<String> getAndDelete(String key);

    /** @return true if the key existed */
    boolean delete(String key);

    boolean exists(String key);

    /** SADD the member and (re)set the set's own expiry. */
    void addToSet(String key, String member, Duration ttl);

    void removeFromSet(String key, String member);

    Set<String> members(String key);
}
