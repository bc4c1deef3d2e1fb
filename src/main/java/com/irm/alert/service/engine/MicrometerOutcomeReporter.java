package com.irm.alert.service.engine;

import com.irm.alert.service.config.MetricsConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * OutcomeReporter backed by the Micrometer counters in {@link MetricsConfig}.
 *
 * A failing meter registry is logged and ignored.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MicrometerOutcomeReporter implements OutcomeReporter {

    private final MetricsConfig metricsConfig;

    @Override
    public void incrementReceived(int count) {
        safely("received", () -> metricsConfig.getAlertsReceived().increment(count));
    }

    @Override
    public void incrementNew() {
        safely("new", () -> metricsConfig.getAlertsNew().increment());
    }

    @Override
    public void incrementDuplicate() {
        safely("duplicate", () -> metricsConfig.getAlertsDuplicate().increment());
    }

    @Override
    public void incrementUpdated() {
        safely("updated", () -> metricsConfig.getAlertsUpdated().increment());
    }

    @Override
    public void incrementFailed(String errorCode) {
        safely("failed", () -> metricsConfig.failedCounter(errorCode).increment());
    }

    private void safely(String counter, Runnable increment) {
        try {
            increment.run();
        } catch (RuntimeException e) {
            log.warn("Failed to record {} counter: {}", counter, e.getMessage());
        }
    }
}
