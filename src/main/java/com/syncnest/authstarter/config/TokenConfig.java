package com.syncnest.authstarter.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(TokenProperties.class)
public class TokenConfig {

    /** Parsed and validated once; start-up fails on a bad secret or duration. */
    @Bean
    public TokenSettings tokenSettings(TokenProperties props) {
        return TokenSettings.from(props);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
