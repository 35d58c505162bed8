package com.myinfra.gateway.authgateway.search;

import com.myinfra.gateway.authgateway.config.AppConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Periodically removes access log records older than {@code app.search.retention-days}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IndexRetentionTask {

    private final RetryingIndexQueue indexQueue;
    private final AppConfig appConfig;

    @Scheduled(cron = "${app.search.retention-cron:0 0 3 * * *}")
    public void deleteOldAccessLogs() {
        purge().subscribe();
    }

    /**
     * Deletes expired access log records.
     *
     * @return Mono completing once the deletion finished or failed; never errors
     */
    Mono<Void> purge() {
        AppConfig.SearchConfig search = appConfig.getSearch();
        if (!indexQueue.isEnabled() || search == null || search.getRetentionDays() <= 0
                || search.getAccessLogIndex() == null || search.getAccessLogIndex().isBlank()) {
            return Mono.empty();
        }

        String index = search.getAccessLogIndex();
        int days = search.getRetentionDays();

        return indexQueue.deleteOlderThan(index, days)
                .doOnNext(deleted -> log.info("Deleted {} records older than {} days from '{}'", deleted, days, index))
                .doOnError(e -> log.error("Deleting old records from '{}' failed: {}", index, e.getMessage()))
                .onErrorResume(e -> Mono.empty())
                .then();
    }
}
