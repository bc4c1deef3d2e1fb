package com.irm.alert.service.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.irm.alert.service.config.AlertServiceConfig;
import com.irm.alert.service.config.MetricsConfig;
import com.irm.alert.service.engine.BatchResult;
import com.irm.alert.service.engine.DefaultReconciliationEngine;
import com.irm.alert.service.engine.EventOutcome;
import com.irm.alert.service.engine.MicrometerOutcomeReporter;
import com.irm.alert.service.engine.OutcomeType;
import com.irm.alert.service.engine.ReconciliationEngine;
import com.irm.alert.service.persistence.AlertPayloadSerializer;
import com.irm.alert.service.persistence.InMemoryAlertStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

class AlertWebhookServiceTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private SimpleMeterRegistry registry;
    private InMemoryAlertStore store;
    private AlertWebhookService service;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        MetricsConfig metricsConfig = new MetricsConfig(registry);
        MicrometerOutcomeReporter reporter = new MicrometerOutcomeReporter(metricsConfig);
        store = new InMemoryAlertStore(metricsConfig);
        DefaultReconciliationEngine engine = new DefaultReconciliationEngine(store,
                new AlertPayloadSerializer(new ObjectMapper()), reporter, new AlertServiceConfig(), Clock.systemUTC());
        service = new AlertWebhookService(new DefaultAlertEventNormalizer(), engine, reporter, metricsConfig);
    }

    @Test
    void invalidAlertInTheMiddle_othersStillPersisted() {
        BatchResult result = service.process(List.of(
                raw("valid-1", "firing"),
                raw("", "firing"),
                raw("valid-2", "firing")));

        assertThat(result.outcomes()).extracting(EventOutcome::type)
                .containsExactly(OutcomeType.NEW, OutcomeType.ERROR, OutcomeType.NEW);
        assertThat(result.get(1).errorCode()).isEqualTo(AlertProcessingException.VALIDATION_ERROR);
        assertThat(result.countErrors(AlertProcessingException.VALIDATION_ERROR)).isEqualTo(1);
        assertThat(result.hasErrorsOtherThan(AlertProcessingException.VALIDATION_ERROR)).isFalse();

        assertThat(store.findByFingerprint("valid-1")).isPresent();
        assertThat(store.findByFingerprint("valid-2")).isPresent();
        assertThat(store.count()).isEqualTo(2);
    }

    @Test
    void receivedCounter_countsEveryAlertIncludingInvalidOnes() {
        service.process(Arrays.asList(raw("a1", "firing"), null, raw(null, "firing")));

        assertThat(registry.get("irm.webhooks.alertmanager").counter().count()).isEqualTo(3.0);
        assertThat(registry.get("irm.webhooks.alertmanager.new").counter().count()).isEqualTo(1.0);
        assertThat(registry.get(MetricsConfig.FAILED_COUNTER).tag("reason", "VALIDATION_ERROR")
                .counter().count()).isEqualTo(2.0);
        assertThat(registry.get("irm.webhooks.alertmanager.batch.duration").timer().count()).isEqualTo(1);
    }

    @Test
    void unexpectedEngineFailure_batchIsStillTimed() {
        MetricsConfig metricsConfig = new MetricsConfig(registry);
        ReconciliationEngine failingEngine = Mockito.mock(ReconciliationEngine.class);
        when(failingEngine.reconcile(any(AlertEvent.class))).thenThrow(new IllegalStateException("engine crashed"));
        AlertWebhookService failingService = new AlertWebhookService(new DefaultAlertEventNormalizer(),
                failingEngine, new MicrometerOutcomeReporter(metricsConfig), metricsConfig);

        assertThatThrownBy(() -> failingService.process(List.of(raw("a1", "firing"))))
                .isInstanceOf(IllegalStateException.class);

        assertThat(registry.get("irm.webhooks.alertmanager.batch.duration").timer().count()).isEqualTo(1);
    }

    @Test
    void emptyBatch_returnsEmptyResult() {
        BatchResult result = service.process(List.of());

        assertThat(result.size()).isZero();
        assertThat(result.hasErrors()).isFalse();
    }

    private static RawAlert raw(String fingerprint, String status) {
        return new RawAlert(fingerprint, status, Map.of("alertname", "DiskFull"), Map.of(), T0, null);
    }
}
