package com.irm.alert.service.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

/**
 * Metrics configuration for the IRM Alert Service.
 *
 * Provides the webhook outcome counters and the batch timer.
 * Names keep the {@code irm_webhooks_alertmanager_*} series that dashboards already use.
 */
@Configuration
@Getter
public class MetricsConfig {

    public static final String FAILED_COUNTER = "irm.webhooks.alertmanager.failed";

    private final MeterRegistry registry;

    // Counters
    private final Counter alertsReceived;
    private final Counter alertsNew;
    private final Counter alertsDuplicate;
    private final Counter alertsUpdated;

    // Timers
    private final Timer batchTimer;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        this.alertsReceived = Counter.builder("irm.webhooks.alertmanager")
                .description("Total number of received webhooks")
                .register(registry);

        this.alertsNew = Counter.builder("irm.webhooks.alertmanager.new")
                .description("Total number of new unique webhook inserted into the database")
                .register(registry);

        this.alertsDuplicate = Counter.builder("irm.webhooks.alertmanager.duplicate")
                .description("Total number of duplicate webhooks (already exists in DB)")
                .register(registry);

        this.alertsUpdated = Counter.builder("irm.webhooks.alertmanager.updated")
                .description("Total number of webhooks that were updated")
                .register(registry);

        this.batchTimer = Timer.builder("irm.webhooks.alertmanager.batch.duration")
                .description("Time taken to reconcile one webhook batch")
                .register(registry);
    }

    /**
     * Returns the failure counter for an error code, registering it on first use.
     *
     * @param errorCode the error code of the failed event
     * @return the counter tagged with the error code
     */
    public Counter failedCounter(String errorCode) {
        return Counter.builder(FAILED_COUNTER)
                .description("Total number of webhook alerts that could not be reconciled")
                .tag("reason", errorCode)
                .register(registry);
    }

    /**
     * Registers a gauge for store size monitoring.
     *
     * @param name the metric name
     * @param description the metric description
     * @param sizeSupplier supplier for the current size
     */
    public void registerStoreGauge(String name, String description, Supplier<Number> sizeSupplier) {
        Gauge.builder(name, sizeSupplier)
                .description(description)
                .register(registry);
    }
}
