package com.irm.alert.service.api.controller;

import com.irm.alert.service.api.dto.AlertResponse;
import com.irm.alert.service.api.dto.ApiResponse;
import com.irm.alert.service.config.AlertServiceConfig;
import com.irm.alert.service.persistence.AlertPayloadSerializer;
import com.irm.alert.service.persistence.AlertRecord;
import com.irm.alert.service.persistence.AlertStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Controller for querying stored alert state.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/alerts")
@Tag(name = "Alerts", description = "Endpoints for querying the reconciled alert state")
@RequiredArgsConstructor
public class AlertQueryController {

    private final AlertStore alertStore;
    private final AlertPayloadSerializer payloadSerializer;
    private final AlertServiceConfig config;

    @GetMapping
    @Operation(summary = "List alerts", description = "Returns stored alerts, most recently created first")
    public ResponseEntity<ApiResponse<List<AlertResponse>>> listAlerts(
            @Parameter(description = "Only alerts with this status") @RequestParam(required = false) String status,
            @Parameter(description = "Maximum number of alerts") @RequestParam(required = false) Integer limit) {

        int effectiveLimit = resolveLimit(limit);
        log.debug("Listing alerts: status={}, limit={}", status, effectiveLimit);

        var alerts = alertStore.findAll(status, effectiveLimit).stream()
                .map(this::toResponse)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(alerts));
    }

    @GetMapping("/{fingerprint}")
    @Operation(summary = "Get alert by fingerprint", description = "Returns the current state of one alert")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Alert found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Alert not found")
    })
    public ResponseEntity<ApiResponse<AlertResponse>> getAlert(
            @Parameter(description = "Alert fingerprint") @PathVariable String fingerprint) {
        log.debug("Getting alert: {}", fingerprint);
        return alertStore.findByFingerprint(fingerprint)
                .map(record -> ResponseEntity.ok(ApiResponse.success(toResponse(record))))
                .orElseGet(() -> notFoundResponse(fingerprint));
    }

    // ==================== Helpers ====================

    private int resolveLimit(Integer requested) {
        var query = config.getQuery();
        if (requested == null) {
            return query.getDefaultLimit();
        }
        if (requested < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        return Math.min(requested, query.getMaxLimit());
    }

    private ResponseEntity<ApiResponse<AlertResponse>> notFoundResponse(String fingerprint) {
        log.warn("Alert not found: {}", fingerprint);
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error("Alert not found: " + fingerprint, "NOT_FOUND"));
    }

    private AlertResponse toResponse(AlertRecord record) {
        return AlertResponse.builder()
                .id(record.id())
                .fingerprint(record.fingerprint())
                .status(record.status())
                .labels(payloadSerializer.deserialize(record.fingerprint(), record.labels()))
                .annotations(payloadSerializer.deserialize(record.fingerprint(), record.annotations()))
                .startsAt(record.startsAt())
                .endsAt(record.endsAt())
                .createdAt(record.createdAt())
                .build();
    }
}
