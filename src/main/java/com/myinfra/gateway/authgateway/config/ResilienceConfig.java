package com.myinfra.gateway.authgateway.config;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class ResilienceConfig {

    static final String SEARCH_INDEX_RETRY = "search-index";

    private static final Duration MIN_RETRY_WAIT = Duration.ofMillis(1);

    private final AppConfig appConfig;

    /**
     * Retry policy applied to every queued write to the search backend.
     * The first attempt plus {@code app.search.retries} retries.
     *
     * @return Retry instance for search indexing
     */
    @Bean
    public Retry searchIndexRetry() {
        AppConfig.SearchConfig search = appConfig.getSearch();

        int retries = 3;
        Duration waitDuration = Duration.ofSeconds(1);

        if (search != null) {
            retries = Math.max(0, search.getRetries());
            if (search.getRetryWait() != null && search.getRetryWait().compareTo(MIN_RETRY_WAIT) >= 0) {
                waitDuration = search.getRetryWait();
            }
        }

        log.debug("Configuring search index retry: retries={}, wait={}ms", retries, waitDuration.toMillis());

        return searchIndexRetry(retries, waitDuration);
    }

    /**
     * Builds the search index retry policy.
     *
     * @param retries      Number of retries after the first failed attempt
     * @param waitDuration Pause between attempts, at least one millisecond
     * @return Retry instance
     */
    public static Retry searchIndexRetry(int retries, Duration waitDuration) {
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(retries + 1)
                .waitDuration(waitDuration)
                .build();

        return Retry.of(SEARCH_INDEX_RETRY, retryConfig);
    }
}
