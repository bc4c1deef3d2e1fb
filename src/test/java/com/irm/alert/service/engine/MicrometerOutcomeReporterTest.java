package com.irm.alert.service.engine;

import com.irm.alert.service.config.MetricsConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

class MicrometerOutcomeReporterTest {

    @Test
    void increments_landOnNamedCounters() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MicrometerOutcomeReporter reporter = new MicrometerOutcomeReporter(new MetricsConfig(registry));

        reporter.incrementReceived(3);
        reporter.incrementNew();
        reporter.incrementUpdated();
        reporter.incrementDuplicate();
        reporter.incrementDuplicate();
        reporter.incrementFailed("VALIDATION_ERROR");

        assertThat(registry.get("irm.webhooks.alertmanager").counter().count()).isEqualTo(3.0);
        assertThat(registry.get("irm.webhooks.alertmanager.new").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("irm.webhooks.alertmanager.updated").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("irm.webhooks.alertmanager.duplicate").counter().count()).isEqualTo(2.0);
        assertThat(registry.get(MetricsConfig.FAILED_COUNTER).tag("reason", "VALIDATION_ERROR")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void brokenMetricsSink_neverThrows() {
        MetricsConfig broken = Mockito.mock(MetricsConfig.class);
        when(broken.getAlertsNew()).thenThrow(new IllegalStateException("registry closed"));
        when(broken.getAlertsReceived()).thenThrow(new IllegalStateException("registry closed"));
        when(broken.failedCounter(anyString())).thenThrow(new IllegalStateException("registry closed"));
        MicrometerOutcomeReporter reporter = new MicrometerOutcomeReporter(broken);

        assertThatCode(() -> {
            reporter.incrementReceived(1);
            reporter.incrementNew();
            reporter.incrementUpdated();
            reporter.incrementDuplicate();
            reporter.incrementFailed("PERSISTENCE_ERROR");
        }).doesNotThrowAnyException();
    }
}
