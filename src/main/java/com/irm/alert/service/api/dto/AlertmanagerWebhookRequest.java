package com.irm.alert.service.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.irm.alert.service.ingest.RawAlert;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * DTO for the Alertmanager webhook payload.
 *
 * Only {@code alerts} is used for reconciliation; the group-level fields are
 * accepted so the payload binds as Alertmanager sends it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertmanagerWebhookRequest {

    /**
     * Webhook payload version ("4" for current Alertmanager releases).
     */
    private String version;

    private String groupKey;

    /**
     * Number of alerts Alertmanager dropped because of max_alerts.
     */
    private Integer truncatedAlerts;

    /**
     * Group status: firing or resolved.
     */
    private String status;

    private String receiver;

    private Map<String, String> groupLabels;

    private Map<String, String> commonLabels;

    private Map<String, String> commonAnnotations;

    @JsonProperty("externalURL")
    private String externalUrl;

    /**
     * Alerts in this notification. Individual alerts are validated one by one.
     */
    @NotNull(message = "alerts is required")
    private List<AlertDto> alerts;

    public List<RawAlert> toRawAlerts() {
        return alerts.stream()
                .map(alert -> alert != null ? alert.toRawAlert() : null)
                .toList();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AlertDto {

        /**
         * Alert status: firing or resolved.
         */
        private String status;

        private Map<String, String> labels;

        private Map<String, String> annotations;

        private Instant startsAt;

        /**
         * End time; {@code 0001-01-01T00:00:00Z} while the alert is still firing.
         */
        private Instant endsAt;

        @JsonProperty("generatorURL")
        private String generatorUrl;

        /**
         * Stable identifier of the alert, used for deduplication.
         */
        private String fingerprint;

        RawAlert toRawAlert() {
            return new RawAlert(fingerprint, status, labels, annotations, startsAt, endsAt);
        }
    }
}
