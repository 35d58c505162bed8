package com.myinfra.gateway.authgateway.search;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Best-effort writer to the search backend.
 * <p>
 * Submitted records are written one at a time in submission order, each retried under the
 * configured {@link Retry} policy. At most {@code capacity} records wait behind the one being written;
 * further records are dropped and logged. Callers of {@link #submit} never wait and never observe a failure.
 * {@link #search} and {@link #deleteOlderThan} bypass the queue and report failures to the caller.
 * Without a backend every operation is a no-op.
 */
@Slf4j
public class RetryingIndexQueue implements AutoCloseable {

    static final String DATE_FIELD = "date";

    public static final int DEFAULT_CAPACITY = 10_000;

    private final IndexBackend backend;
    private final Retry retry;
    private final IndexingFailureListener failureListener;
    private final Clock clock;
    private final Sinks.Many<IndexTask> tasks;
    private final Object emitLock = new Object();
    private final Disposable worker;

    /**
     * @param backend         Search backend, or null when indexing is not configured
     * @param retry           Retry policy for each queued write
     * @param failureListener Notified of every failed attempt
     * @param clock           Clock used for retention cutoffs
     */
    public RetryingIndexQueue(IndexBackend backend,
                              Retry retry,
                              IndexingFailureListener failureListener,
                              Clock clock) {
        this(backend, retry, failureListener, clock, DEFAULT_CAPACITY);
    }

    /**
     * @param backend         Search backend, or null when indexing is not configured
     * @param retry           Retry policy for each queued write
     * @param failureListener Notified of every failed attempt
     * @param clock           Clock used for retention cutoffs
     * @param capacity        Maximum number of records waiting to be written
     */
    public RetryingIndexQueue(IndexBackend backend,
                              Retry retry,
                              IndexingFailureListener failureListener,
                              Clock clock,
                              int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("Index queue capacity must be positive: " + capacity);

        this.backend = backend;
        this.retry = Objects.requireNonNull(retry, "Retry must not be null");
        this.failureListener = Objects.requireNonNull(failureListener, "IndexingFailureListener must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.tasks = Sinks.many().unicast().onBackpressureBuffer(new ArrayBlockingQueue<>(capacity));

        if (backend == null) {
            log.warn("Search indexing is not enabled");
            this.worker = null;
        } else {
            this.worker = tasks.asFlux()
                    .concatMap(this::execute, 0)
                    .subscribe(
                            ignored -> { },
                            e -> log.error("Index queue worker stopped: {}", e.getMessage(), e));
        }
    }

    public boolean isEnabled() {
        return backend != null;
    }

    /**
     * Queues a record for indexing and returns immediately.
     *
     * @param index  Target index
     * @param record Document body
     */
    public void submit(String index, Map<String, Object> record) {
        if (backend == null) return;

        IndexTask task = new IndexTask(index, Collections.unmodifiableMap(new LinkedHashMap<>(record)));
        Sinks.EmitResult result;
        // concurrent submitters take turns here instead of failing with FAIL_NON_SERIALIZED
        synchronized (emitLock) {
            result = tasks.tryEmitNext(task);
        }

        if (result == Sinks.EmitResult.FAIL_OVERFLOW) {
            log.warn("Index queue is full, dropping record for index '{}'", index);
        } else if (result.isFailure()) {
            log.warn("Index queue is not accepting records ({}), dropping record for index '{}'", result, index);
        }
    }

    /**
     * Runs a search directly against the backend.
     *
     * @param index Index to search
     * @param query Search request body
     * @return The backend response, or empty if indexing is not configured
     */
    public Mono<JsonNode> search(String index, Map<String, Object> query) {
        if (backend == null) return Mono.empty();
        return backend.search(index, query);
    }

    /**
     * Deletes every record whose {@code date} is at or before now minus {@code days}.
     * The cutoff is fixed when this method is called.
     *
     * @param index Index to delete from
     * @param days  Age in days (e.g., 30 deletes month-old records)
     * @return Number of deleted records, or empty if indexing is not configured
     */
    public Mono<Long> deleteOlderThan(String index, int days) {
        if (backend == null) return Mono.empty();

        Instant cutoff = clock.instant().minus(Duration.ofDays(days));
        log.debug("Deleting records in '{}' dated at or before {}", index, cutoff);
        return backend.deleteByQuery(index, olderThanQuery(cutoff));
    }

    static Map<String, Object> olderThanQuery(Instant cutoff) {
        Map<String, Object> range = Map.of("range", Map.of(DATE_FIELD, Map.of("lte", cutoff.toString())));
        return Map.of("query", Map.of("bool", Map.of("must", List.of(range))));
    }

    /**
     * Stops the worker. Records still waiting in the queue are dropped.
     */
    @Override
    public void close() {
        if (worker != null && !worker.isDisposed()) {
            worker.dispose();
            log.info("Index queue closed");
        }
    }

    private Mono<Void> execute(IndexTask task) {
        int maxAttempts = retry.getRetryConfig().getMaxAttempts();
        AtomicInteger attempts = new AtomicInteger();

        return Mono.defer(() -> backend.index(task.index(), task.record()))
                .doOnError(e -> failureListener.onFailedAttempt(
                        task.index(), e, maxAttempts - attempts.incrementAndGet()))
                .transformDeferred(RetryOperator.of(retry))
                .onErrorResume(e -> {
                    log.error("Dropping record for index '{}' after {} attempts", task.index(), attempts.get());
                    return Mono.empty();
                });
    }

    private record IndexTask(String index, Map<String, Object> record) {
    }
}
