package com.irm.alert.service.config;

import com.irm.alert.service.engine.DuplicateKeyPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Overall application configuration for the IRM Alert Service.
 *
 * Contains the store selection, reconciliation policy, and query limits.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "irm")
public class AlertServiceConfig {

    /**
     * Alert store settings.
     */
    private StoreConfig store = new StoreConfig();

    /**
     * Reconciliation engine settings.
     */
    private ReconcileConfig reconcile = new ReconcileConfig();

    /**
     * Query API settings.
     */
    private QueryConfig query = new QueryConfig();

    @Getter
    @Setter
    public static class StoreConfig {

        /**
         * Store backend: "jdbc" (PostgreSQL) or "memory".
         */
        private String type = "jdbc";
    }

    @Getter
    @Setter
    public static class ReconcileConfig {

        /**
         * What to do when a first insert loses the race against a concurrent batch.
         */
        private DuplicateKeyPolicy duplicateKeyPolicy = DuplicateKeyPolicy.RETRY_AS_UPDATE;
    }

    @Getter
    @Setter
    public static class QueryConfig {

        /**
         * Number of alerts returned when no limit is given.
         */
        private int defaultLimit = 100;

        /**
         * Upper bound applied to any requested limit.
         */
        private int maxLimit = 1000;
    }
}
