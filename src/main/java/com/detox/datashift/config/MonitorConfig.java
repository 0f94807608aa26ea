package com.detox.datashift.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.web.client.RestClient;

import java.time.Clock;

/**
 * Shared infrastructure for the shift monitor: JSON mapping, time source and the
 * HTTP client for the evaluation service.
 */
@Slf4j
@Configuration
@EnableScheduling
public class MonitorConfig {

    @Bean
    public ObjectMapper objectMapper() {
        return createObjectMapper();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Read timeout bounds every scoring call; a timeout surfaces as a scoring failure.
     */
    @Bean
    @ConditionalOnProperty(name = "scoring.enabled", havingValue = "true")
    public RestClient scoringRestClient(
            RestClient.Builder builder,
            @Value("${scoring.base-url}") String baseUrl,
            @Value("${scoring.connect-timeout-ms:5000}") int connectTimeoutMs,
            @Value("${scoring.timeout-ms:30000}") int readTimeoutMs
    ) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);

        log.info("Quality scoring client initialised -> {}", baseUrl);
        return builder
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .build();
    }

    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
