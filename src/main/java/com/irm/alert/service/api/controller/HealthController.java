package com.irm.alert.service.api.controller;

import com.irm.alert.service.persistence.AlertStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness probe used by the deployment, checking that the alert store answers.
 */
@RestController
@Tag(name = "Health", description = "Deployment health probe")
@RequiredArgsConstructor
public class HealthController {

    private final AlertStore alertStore;

    @GetMapping("/healthz")
    @Operation(summary = "Health check", description = "Reports whether the alert store is reachable")
    public ResponseEntity<Map<String, String>> healthz() {
        if (!alertStore.isAvailable()) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("status", "unhealthy", "error", "database unreachable"));
        }
        return ResponseEntity.ok(Map.of("status", "healthy"));
    }
}
