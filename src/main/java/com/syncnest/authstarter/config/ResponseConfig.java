package com.syncnest.authstarter.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.json.ProblemDetailJacksonMixin;

import java.util.TimeZone;

/**
 * Shared ObjectMapper settings, used for HTTP bodies and for the refresh-token records
 * kept in Redis. Unknown properties are ignored so older records stay readable.
 */
@Configuration
public class ResponseConfig {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer jsonCustomizer() {
        return builder -> builder
                .serializationInclusion(JsonInclude.Include.NON_ABSENT)
                .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS,
                        DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES,
                        DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
                .timeZone(TimeZone.getTimeZone("UTC"))
                // problem extensions (code, requestId, ...) at the top level of error bodies
                .mixIn(ProblemDetail.class, ProblemDetailJacksonMixin.class)
                .modulesToInstall(new JavaTimeModule(),
                        new com.fasterxml.jackson.datatype.jdk8.Jdk8Module());
    }
}
