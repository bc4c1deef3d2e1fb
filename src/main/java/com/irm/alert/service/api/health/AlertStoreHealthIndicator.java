package com.irm.alert.service.api.health;

import com.irm.alert.service.config.AlertServiceConfig;
import com.irm.alert.service.persistence.AlertStore;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the alert store.
 *
 * Reports reachability, backend type, and record count.
 */
@Component
@RequiredArgsConstructor
public class AlertStoreHealthIndicator implements HealthIndicator {

    private final AlertStore alertStore;
    private final AlertServiceConfig config;

    @Override
    public Health health() {
        String storeType = config.getStore().getType();
        if (!alertStore.isAvailable()) {
            return Health.down()
                    .withDetail("storeType", storeType)
                    .withDetail("error", "database unreachable")
                    .build();
        }
        return Health.up()
                .withDetail("storeType", storeType)
                .withDetail("alertCount", alertStore.count())
                .build();
    }
}
