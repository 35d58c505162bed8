package com.myinfra.gateway.authgateway.search;

import com.myinfra.gateway.authgateway.config.ResilienceConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class RetryingIndexQueueTest {

    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");
    private static final Duration AWAIT_DURATION = Duration.ofSeconds(10);

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final List<Integer> attemptsLeft = new CopyOnWriteArrayList<>();
    private final IndexingFailureListener listener = (index, error, left) -> attemptsLeft.add(left);

    private FakeIndexBackend backend;
    private RetryingIndexQueue queue;

    @BeforeEach
    void setUp() {
        backend = new FakeIndexBackend();
        queue = new RetryingIndexQueue(backend, ResilienceConfig.searchIndexRetry(3, Duration.ofMillis(10)), listener, clock);
    }

    @AfterEach
    void tearDown() {
        queue.close();
    }

    @Test
    void writesReachBackendInSubmissionOrderDespiteTransientFailures() {
        backend.transientFailures.set(2);

        IntStream.range(0, 10).forEach(i -> queue.submit("events", Map.of("seq", i)));

        await().atMost(AWAIT_DURATION).untilAsserted(() -> assertThat(backend.indexed).hasSize(10));
        assertThat(backend.indexed).extracting(record -> record.get("seq"))
                .containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
        assertThat(backend.maxInFlight).hasValue(1);
        assertThat(backend.attempts).hasValue(12);
        assertThat(attemptsLeft).containsExactly(3, 2);
    }

    @Test
    void exhaustedRecordIsDroppedAndQueueKeepsGoing() {
        backend.permanentFailure = record -> "poison".equals(record.get("name"));

        queue.submit("events", Map.of("name", "poison"));
        queue.submit("events", Map.of("name", "healthy"));

        await().atMost(AWAIT_DURATION).untilAsserted(() -> assertThat(backend.indexed).hasSize(1));
        assertThat(backend.indexed.get(0)).containsEntry("name", "healthy");
        assertThat(attemptsLeft).containsExactly(3, 2, 1, 0);
        assertThat(backend.attempts).hasValue(5);
    }

    @Test
    void submitReturnsWhileWritesAreStillPending() {
        FakeIndexBackend stuck = new FakeIndexBackend() {
            @Override
            public Mono<Void> index(String index, Map<String, Object> record) {
                attempts.incrementAndGet();
                return Mono.never();
            }
        };
        RetryingIndexQueue stuckQueue = new RetryingIndexQueue(stuck,
                ResilienceConfig.searchIndexRetry(3, Duration.ofMillis(10)), listener, clock);

        try {
            stuckQueue.submit("events", Map.of("seq", 1));
            stuckQueue.submit("events", Map.of("seq", 2));
            stuckQueue.submit("events", Map.of("seq", 3));

            await().atMost(AWAIT_DURATION).untilAsserted(() -> assertThat(stuck.attempts).hasValue(1));
            assertThat(stuck.attempts).hasValue(1);
        } finally {
            stuckQueue.close();
        }
    }

    @Test
    void dropsRecordsBeyondCapacityAndKeepsAccepting() {
        Sinks.Empty<Void> gate = Sinks.empty();
        backend.gate = gate.asMono();
        RetryingIndexQueue bounded = new RetryingIndexQueue(backend,
                ResilienceConfig.searchIndexRetry(0, Duration.ofMillis(10)), listener, clock, 2);

        try {
            IntStream.range(0, 10).forEach(i -> bounded.submit("events", Map.of("seq", i)));
            gate.tryEmitEmpty();

            await().atMost(AWAIT_DURATION).untilAsserted(() -> assertThat(backend.indexed).hasSize(3));
            await().during(Duration.ofMillis(200)).atMost(AWAIT_DURATION)
                    .untilAsserted(() -> assertThat(backend.indexed).hasSize(3));
            assertThat(backend.indexed).extracting(record -> record.get("seq")).containsExactly(0, 1, 2);

            bounded.submit("events", Map.of("seq", 99));
            await().atMost(AWAIT_DURATION).untilAsserted(() -> assertThat(backend.indexed).hasSize(4));
            assertThat(backend.indexed.get(3)).containsEntry("seq", 99);
        } finally {
            bounded.close();
        }
    }

    @Test
    void concurrentSubmittersLoseNothing() throws Exception {
        backend.latency = Duration.ZERO;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);

        try {
            for (int t = 0; t < 8; t++) {
                int thread = t;
                executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 50; i++) {
                        queue.submit("events", Map.of("thread", thread, "seq", i));
                    }
                    return null;
                });
            }
            start.countDown();

            await().atMost(AWAIT_DURATION).untilAsserted(() -> assertThat(backend.indexed).hasSize(400));
            assertThat(backend.maxInFlight).hasValue(1);
            for (int t = 0; t < 8; t++) {
                int thread = t;
                assertThat(backend.indexed.stream().filter(record -> record.get("thread").equals(thread)))
                        .extracting(record -> record.get("seq"))
                        .containsExactlyElementsOf(IntStream.range(0, 50).boxed().toList());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new RetryingIndexQueue(backend,
                ResilienceConfig.searchIndexRetry(0, Duration.ofMillis(10)), listener, clock, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void copiesRecordAtSubmission() {
        Map<String, Object> record = new java.util.HashMap<>();
        record.put("seq", 1);
        record.put("optional", null);

        queue.submit("events", record);
        record.put("seq", 2);

        await().atMost(AWAIT_DURATION).untilAsserted(() -> assertThat(backend.indexed).hasSize(1));
        assertThat(backend.indexed.get(0)).containsEntry("seq", 1).containsKey("optional");
        assertThat(backend.indexNames).containsExactly("events");
    }

    @Test
    void deleteOlderThanIssuesOneDeleteWithCutoff() {
        backend.deletedCount = 5;

        Long deleted = queue.deleteOlderThan("gateway-access-logs", 30).block();

        assertThat(deleted).isEqualTo(5L);
        assertThat(backend.deleteIndexNames).containsExactly("gateway-access-logs");
        assertThat(backend.deleteQueries).containsExactly(Map.of("query", Map.of("bool", Map.of("must", List.of(
                Map.of("range", Map.of("date", Map.of("lte", "2026-09-19T12:00:00Z"))))))));
    }

    @Test
    void deleteFailureReachesCaller() {
        backend.deleteFailure = new SearchBackendException("unavailable", 503);

        assertThatThrownBy(() -> queue.deleteOlderThan("gateway-access-logs", 30).block())
                .isInstanceOf(SearchBackendException.class);
        assertThat(backend.deleteQueries).hasSize(1);
    }

    @Test
    void searchPassesThrough() {
        assertThat(queue.search("events", Map.of("query", Map.of("match_all", Map.of()))).block().path("index").asText())
                .isEqualTo("events");
    }

    @Test
    void withoutBackendEverythingIsANoOp() {
        RetryingIndexQueue disabled = new RetryingIndexQueue(null,
                ResilienceConfig.searchIndexRetry(3, Duration.ofMillis(10)), listener, clock);

        disabled.submit("events", Map.of("seq", 1));

        assertThat(disabled.isEnabled()).isFalse();
        assertThat(disabled.search("events", Map.of()).blockOptional()).isEmpty();
        assertThat(disabled.deleteOlderThan("events", 30).blockOptional()).isEmpty();
        disabled.close();
    }

    @Test
    void submitAfterCloseIsIgnored() {
        queue.close();

        queue.submit("events", Map.of("seq", 1));

        assertThat(backend.attempts).hasValue(0);
    }
}
