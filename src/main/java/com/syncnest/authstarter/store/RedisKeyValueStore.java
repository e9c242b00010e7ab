package com.syncnest.authstarter.store;

import com.syncnest.authstarter.config.StoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link KeyValueStore} over a shared {@link StringRedisTemplate}.
 * <p>
 * Transient failures (connection drops, command timeouts) are retried with capped
 * exponential backoff; after {@code store.redis.retry.max-attempts} the call fails
 * with {@link StoreUnavailableException}. Other Redis errors are not retried.
 * Only the key namespace is logged, never the key itself (keys embed raw tokens).
 */
@Slf4j
@Component
public class RedisKeyValueStore implements KeyValueStore {

    private final StringRedisTemplate redis;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final Sleeper sleeper;

    @Autowired
    public RedisKeyValueStore(StringRedisTemplate redis, StoreProperties props) {
        this(redis, props, d -> Thread.sleep(d.toMillis()));
    }

    RedisKeyValueStore(StringRedisTemplate redis, StoreProperties props, Sleeper sleeper) {
        StoreProperties.Retry retry = props.getRetry();
        this.redis = redis;
        this.maxAttempts = Math.max(1, retry.getMaxAttempts());
        this.initialBackoff = retry.getInitialBackoff();
        this.maxBackoff = retry.getMaxBackoff();
        this.sleeper = sleeper;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(execute("GET", key, () -> redis.opsForValue().get(key)));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        requirePositive(ttl);
        execute("SET", key, () -> {
            redis.opsForValue().set(key, value, ttl);
            return null;
        });
    }

    @Override
    public Optional<String> getAndDelete(String key) {
        return Optional.ofNullable(execute("GETDEL", key, () -> redis.opsForValue().getAndDelete(key)));
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(execute("DEL", key, () -> redis.delete(key)));
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(execute("EXISTS", key, () -> redis.hasKey(key)));
    }

    @Override
    public void addToSet(String key, String member, Duration ttl) {
        requirePositive(ttl);
        execute("SADD", key, () -> redis.opsForSet().add(key, member));
        execute("EXPIRE", key, () -> redis.expire(key, ttl));
    }

    @Override
    public void removeFromSet(String key, String member) {
        execute("SREM", key, () -> redis.opsForSet().remove(key, member));
    }

    @Override
    public Set<String> members(String key) {
        Set<String> members = execute("SMEMBERS", key, () -> redis.opsForSet().members(key));
        return members == null ? Set.of() : members;
    }

    // ---------- retry ----------

    private <T> T execute(String command, String key, Supplier<T> call) {
        Duration backoff = initialBackoff;
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (TransientDataAccessException | DataAccessResourceFailureException e) {
                if (attempt >= maxAttempts) {
                    log.error("Redis {} on {} failed after {} attempt(s)", command, namespace(key), attempt, e);
                    throw new StoreUnavailableException("Key-value store unavailable (" + command + ")", e);
                }
                log.warn("Redis {} on {} failed (attempt {}/{}), retrying in {} ms: {}",
                        command, namespace(key), attempt, maxAttempts, backoff.toMillis(), e.getMessage());
                pause(backoff, e);
                backoff = backoff.multipliedBy(2);
                if (backoff.compareTo(maxBackoff) > 0) backoff = maxBackoff;
            } catch (DataAccessException e) {
                log.error("Redis {} on {} failed", command, namespace(key), e);
                throw new StoreUnavailableException("Key-value store error (" + command + ")", e);
            }
        }
    }

    private void pause(Duration backoff, RuntimeException cause) {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("Interrupted while waiting to retry", cause);
        }
    }

    private static void requirePositive(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
    }

    static String namespace(String key) {
        int idx = key.lastIndexOf(':');
        return idx < 0 ? "<key>" : key.substring(0, idx + 1) + "*";
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }
}
