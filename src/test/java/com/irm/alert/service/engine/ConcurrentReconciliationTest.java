package com.irm.alert.service.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.irm.alert.service.config.AlertServiceConfig;
import com.irm.alert.service.config.MetricsConfig;
import com.irm.alert.service.ingest.AlertEvent;
import com.irm.alert.service.persistence.AlertPayloadSerializer;
import com.irm.alert.service.persistence.AlertRecord;
import com.irm.alert.service.persistence.InMemoryAlertStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Two batches reconciling the same unseen fingerprint at the same time.
 *
 * The store lets both lookups miss before either insert runs, so one insert
 * always hits the fingerprint uniqueness check.
 */
class ConcurrentReconciliationTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant T1 = Instant.parse("2024-05-01T10:05:00Z");

    private MetricsConfig metricsConfig;
    private AlertServiceConfig config;
    private InMemoryAlertStore store;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        metricsConfig = new MetricsConfig(new SimpleMeterRegistry());
        config = new AlertServiceConfig();
        store = new BarrierStore(metricsConfig, 2);
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void retryAsUpdate_oneNewOneUpdated_noLostUpdate() throws Exception {
        config.getReconcile().setDuplicateKeyPolicy(DuplicateKeyPolicy.RETRY_AS_UPDATE);

        List<EventOutcome> outcomes = runConcurrently(
                new AlertEvent("race", "firing", Map.of(), Map.of(), T0, null),
                new AlertEvent("race", "resolved", Map.of(), Map.of(), T0, T1));

        assertThat(outcomes).extracting(EventOutcome::type)
                .containsExactlyInAnyOrder(OutcomeType.NEW, OutcomeType.UPDATED);
        assertThat(store.count()).isEqualTo(1);

        int updatedIndex = outcomes.get(0).type() == OutcomeType.UPDATED ? 0 : 1;
        String expectedStatus = updatedIndex == 0 ? "firing" : "resolved";
        AlertRecord record = store.findByFingerprint("race").orElseThrow();
        assertThat(record.status()).isEqualTo(expectedStatus);
    }

    @Test
    void reportError_oneNewOneDuplicateKeyError() throws Exception {
        config.getReconcile().setDuplicateKeyPolicy(DuplicateKeyPolicy.REPORT_ERROR);

        List<EventOutcome> outcomes = runConcurrently(
                new AlertEvent("race", "firing", Map.of(), Map.of(), T0, null),
                new AlertEvent("race", "resolved", Map.of(), Map.of(), T0, T1));

        assertThat(outcomes).extracting(EventOutcome::type)
                .containsExactlyInAnyOrder(OutcomeType.NEW, OutcomeType.ERROR);
        assertThat(outcomes).filteredOn(EventOutcome::isError)
                .extracting(EventOutcome::errorCode)
                .containsExactly("DUPLICATE_KEY");
        assertThat(store.count()).isEqualTo(1);
    }

    private List<EventOutcome> runConcurrently(AlertEvent first, AlertEvent second) throws Exception {
        var engine = new DefaultReconciliationEngine(store,
                new AlertPayloadSerializer(new ObjectMapper()),
                new MicrometerOutcomeReporter(metricsConfig),
                config,
                Clock.systemUTC());

        Future<BatchResult> a = executor.submit(() -> engine.reconcile(List.of(first)));
        Future<BatchResult> b = executor.submit(() -> engine.reconcile(List.of(second)));

        await().atMost(5, TimeUnit.SECONDS)
                .until(() -> a.isDone() && b.isDone());

        return List.of(a.get().get(0), b.get().get(0));
    }

    /**
     * Holds the first {@code parties} lookups until all of them have read the store.
     */
    private static class BarrierStore extends InMemoryAlertStore {

        private final CyclicBarrier barrier;
        private final AtomicInteger lookups = new AtomicInteger();
        private final int parties;

        BarrierStore(MetricsConfig metricsConfig, int parties) {
            super(metricsConfig);
            this.parties = parties;
            this.barrier = new CyclicBarrier(parties);
        }

        @Override
        public Optional<AlertRecord> findByFingerprint(String fingerprint) {
            Optional<AlertRecord> result = super.findByFingerprint(fingerprint);
            if (lookups.incrementAndGet() <= parties) {
                try {
                    barrier.await(5, TimeUnit.SECONDS);
                } catch (Exception e) {
                    throw new IllegalStateException("Lookup barrier broken", e);
                }
            }
            return result;
        }
    }
}
