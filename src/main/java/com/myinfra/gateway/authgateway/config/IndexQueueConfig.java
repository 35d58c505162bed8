package com.myinfra.gateway.authgateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myinfra.gateway.authgateway.search.IndexBackend;
import com.myinfra.gateway.authgateway.search.IndexingFailureListener;
import com.myinfra.gateway.authgateway.search.RetryingIndexQueue;
import com.myinfra.gateway.authgateway.search.WebClientIndexBackend;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration
@RequiredArgsConstructor
public class IndexQueueConfig {

    private final AppConfig appConfig;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * The process-wide index queue. A backend is only created when {@code app.search.node} is set.
     *
     * @param webClientBuilder Shared WebClient builder, cloned before customization
     * @param objectMapper     Serializer for request bodies
     * @param searchIndexRetry Retry policy for queued writes
     * @param failureListener  Sink for failed attempts
     * @param clock            Clock for retention cutoffs and request signing
     * @return RetryingIndexQueue, closed on shutdown
     */
    @Bean(destroyMethod = "close")
    public RetryingIndexQueue retryingIndexQueue(WebClient.Builder webClientBuilder,
                                                 ObjectMapper objectMapper,
                                                 Retry searchIndexRetry,
                                                 IndexingFailureListener failureListener,
                                                 Clock clock) {
        AppConfig.SearchConfig search = appConfig.getSearch();

        IndexBackend backend = null;
        int capacity = RetryingIndexQueue.DEFAULT_CAPACITY;
        if (search != null) {
            capacity = search.getQueueCapacity();
            if (search.getNode() != null && !search.getNode().isBlank()) {
                backend = new WebClientIndexBackend(webClientBuilder.clone(), search, objectMapper, clock);
            }
        }

        return new RetryingIndexQueue(backend, searchIndexRetry, failureListener, clock, capacity);
    }
}
