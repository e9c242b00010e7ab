package com.syncnest.authstarter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Retry and reconnect policy for the key-value store, bound from {@code store.redis.*}.
 * Connection details stay under Spring Boot's {@code spring.data.redis.*}.
 */
@Data
@ConfigurationProperties(prefix = "store.redis")
public class StoreProperties {

    private final Retry retry = new Retry();
    private final Reconnect reconnect = new Reconnect();

    @Data
    public static class Retry {
        /** Total attempts per command, including the first one. */
        private int maxAttempts = 3;
        /** Delay before the second attempt; doubled after every failure. */
        private Duration initialBackoff = Duration.ofMillis(50);
        /** Upper bound for a single backoff. */
        private Duration maxBackoff = Duration.ofSeconds(2);
    }

    @Data
    public static class Reconnect {
        private Duration lowerBound = Duration.ofMillis(50);
        private Duration upperBound = Duration.ofSeconds(2);
    }
}
