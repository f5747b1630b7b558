package com.apicatalog.collectionsync.config;

import com.apicatalog.collectionsync.service.sync.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client and retry settings for the remote collection store.
 * Connection details are read from application.yml and injected directly into PostmanCollectionClient.
 */
@Configuration
@Slf4j
public class CollectionStoreConfig {

    @Value("${catalog.sync.call-timeout-ms:30000}")
    private long callTimeoutMs;

    @Value("${catalog.sync.max-attempts:5}")
    private int maxAttempts;

    @Value("${catalog.sync.initial-backoff-ms:500}")
    private long initialBackoffMs;

    @Value("${catalog.sync.max-backoff-ms:30000}")
    private long maxBackoffMs;

    @Bean(name = "collectionRestTemplate")
    public RestTemplate collectionRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofMillis(callTimeoutMs))
                .setReadTimeout(Duration.ofMillis(callTimeoutMs))
                .build();
    }

    @Bean
    public RetryPolicy retryPolicy() {
        log.info("Remote retry policy: {} attempts, backoff {}ms..{}ms", maxAttempts, initialBackoffMs, maxBackoffMs);
        return RetryPolicy.builder()
                .maxAttempts(maxAttempts)
                .initialBackoff(Duration.ofMillis(initialBackoffMs))
                .maxBackoff(Duration.ofMillis(maxBackoffMs))
                .build();
    }
}
