package com.syncnest.authstarter.config;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulConnection;
import io.lettuce.core.resource.DefaultClientResources;
import io.lettuce.core.resource.Delay;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Single shared Redis connection factory for the token stores.
 * Opened with the application context and shut down with it.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({RedisProperties.class, StoreProperties.class})
public class RedisConfig {

    @Bean(destroyMethod = "shutdown")
    DefaultClientResources lettuceClientResources(StoreProperties storeProps) {
        StoreProperties.Reconnect rc = storeProps.getReconnect();
        // capped exponential reconnect: lower, lower*2, ... upper
        return DefaultClientResources.builder()
                .reconnectDelay(Delay.exponential(rc.getLowerBound(), rc.getUpperBound(), 2, TimeUnit.MILLISECONDS))
                .build();
    }

    @Bean
    public LettuceConnectionFactory redisConnectionFactory(RedisProperties props,
                                                           DefaultClientResources clientResources) {

        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration();
        standalone.setHostName(props.getHost());
        standalone.setPort(props.getPort());
        standalone.setDatabase(props.getDatabase());
        if (StringUtils.hasText(props.getUsername())) {
            standalone.setUsername(props.getUsername());
        }
        if (StringUtils.hasText(props.getPassword())) {
            standalone.setPassword(RedisPassword.of(props.getPassword()));
        }

        // Pool must be typed to StatefulConnection<?, ?>
        GenericObjectPoolConfig<StatefulConnection<?, ?>> pool = new GenericObjectPoolConfig<>();
        RedisProperties.Pool p = props.getLettuce() != null ? props.getLettuce().getPool() : null;
        if (p != null && Boolean.TRUE.equals(p.getEnabled())) {
            pool.setMaxTotal(p.getMaxActive());
            pool.setMaxIdle(p.getMaxIdle());
            pool.setMinIdle(p.getMinIdle());
        } else {
            pool.setMaxTotal(32);
            pool.setMaxIdle(16);
            pool.setMinIdle(2);
            pool.setTestOnBorrow(true);
            pool.setTestWhileIdle(true);
        }

        Duration cmdTimeout = (props.getTimeout() != null) ? props.getTimeout() : Duration.ofSeconds(2);

        LettucePoolingClientConfiguration.LettucePoolingClientConfigurationBuilder builder =
                LettucePoolingClientConfiguration.builder()
                        .clientResources(clientResources)
                        .commandTimeout(cmdTimeout)
                        .shutdownTimeout(Duration.ofSeconds(2))
                        .clientOptions(ClientOptions.builder()
                                .autoReconnect(true)
                                // fail fast while disconnected; RedisKeyValueStore owns the retry budget
                                .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                                .timeoutOptions(TimeoutOptions.enabled())
                                .build())
                        .poolConfig(pool);

        if (props.getSsl() != null && props.getSsl().isEnabled()) {
            builder.useSsl();
        }

        LettuceClientConfiguration clientConfig = builder.build();
        log.info("Redis client configured for {}:{} (db {}), command timeout {} ms",
                props.getHost(), props.getPort(), props.getDatabase(), cmdTimeout.toMillis());
        return new LettuceConnectionFactory(standalone, clientConfig);
    }

    @Bean
    public StringRedisTemplate stringRedisTemplate(LettuceConnectionFactory cf) {
        StringRedisTemplate tpl = new StringRedisTemplate();
        tpl.setConnectionFactory(cf);
        StringRedisSerializer s = new StringRedisSerializer();
        tpl.setKeySerializer(s);
        tpl.setValueSerializer(s);
        tpl.setHashKeySerializer(s);
        tpl.setHashValueSerializer(s);
        tpl.afterPropertiesSet();
        return tpl;
    }
}
