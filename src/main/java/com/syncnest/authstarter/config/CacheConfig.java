package com.syncnest.authstarter.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.cache.interceptor.CacheErrorHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.List;

/**
 * Local cache for user lookups made while authenticating a request.
 * Holds no token state: refresh records and blacklist markers are always read from Redis.
 */
@Slf4j
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String USERS_BY_ID = "usersById";

    /** A deleted user stops authenticating within {@link #USER_TTL}. */
    static final Duration USER_TTL = Duration.ofSeconds(30);

    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager mgr = new CaffeineCacheManager();
        mgr.setCaffeine(Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfterWrite(USER_TTL)
                .recordStats());
        mgr.setCacheNames(List.of(USERS_BY_ID));
        // unknown ids are looked up again instead of being remembered as absent
        mgr.setAllowNullValues(false);
        return mgr;
    }

    /** A failing cache degrades to a direct user lookup. */
    @Bean
    public CacheErrorHandler cacheErrorHandler() {
        return new CacheErrorHandler() {
            @Override
            public void handleCacheGetError(@NonNull RuntimeException e, @NonNull Cache cache, @NonNull Object key) {
                log.warn("User cache read failed for {} in {}: {}", key, cache.getName(), e.toString());
            }

            @Override
            public void handleCachePutError(@NonNull RuntimeException e, @NonNull Cache cache,
                                            @NonNull Object key, @Nullable Object value) {
                log.warn("User cache write failed for {} in {}: {}", key, cache.getName(), e.toString());
            }

            @Override
            public void handleCacheEvictError(@NonNull RuntimeException e, @NonNull Cache cache, @NonNull Object key) {
                log.warn("User cache evict failed for {} in {}: {}", key, cache.getName(), e.toString());
            }

            @Override
            public void handleCacheClearError(@NonNull RuntimeException e, @NonNull Cache cache) {
                log.warn("User cache clear failed in {}: {}", cache.getName(), e.toString());
            }
        };
    }
}
