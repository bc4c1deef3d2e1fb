package com.irm.alert.service.api.controller;

import com.irm.alert.service.api.dto.AlertmanagerWebhookRequest;
import com.irm.alert.service.api.dto.ApiResponse;
import com.irm.alert.service.api.dto.WebhookResultResponse;
import com.irm.alert.service.engine.BatchResult;
import com.irm.alert.service.ingest.AlertProcessingException;
import com.irm.alert.service.ingest.AlertWebhookService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Controller for Alertmanager webhook ingestion.
 *
 * Handles POST /api/v1/webhooks/alertmanager. The whole batch is always processed;
 * the status code reflects the worst per-alert failure.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/webhooks/alertmanager")
@Tag(name = "Alertmanager Webhook", description = "Endpoint receiving alert notifications from Alertmanager")
@RequiredArgsConstructor
public class AlertmanagerWebhookController {

    private final AlertWebhookService webhookService;

    /**
     * Reconciles the alerts of one webhook notification.
     *
     * @param request the webhook payload
     * @return 200 if every alert was reconciled, 400 if only validation failures occurred,
     *         500 if any alert failed for another reason
     */
    @PostMapping
    @Operation(
            summary = "Receive Alertmanager webhook",
            description = "Reconciles each alert against stored state by fingerprint: new alerts are inserted, " +
                    "status changes are updated, repeated notifications are ignored."
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "All alerts processed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid payload or alerts"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "500", description = "Some alerts could not be persisted")
    })
    public ResponseEntity<ApiResponse<WebhookResultResponse>> receive(
            @Valid @RequestBody AlertmanagerWebhookRequest request) {

        log.debug("Received Alertmanager webhook: receiver={}, status={}, alertCount={}",
                request.getReceiver(), request.getStatus(), request.getAlerts().size());

        BatchResult result = webhookService.process(request.toRawAlerts());
        WebhookResultResponse body = WebhookResultResponse.from(result);

        if (result.hasErrorsOtherThan(AlertProcessingException.VALIDATION_ERROR)) {
            log.warn("Webhook batch had persistence failures: errors={}", body.errors());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ApiResponse.failure(body, "Some alerts could not be processed", "PROCESSING_ERROR"));
        }
        if (result.hasErrors()) {
            log.warn("Webhook batch had invalid alerts: errors={}", body.errors());
            return ResponseEntity.badRequest()
                    .body(ApiResponse.failure(body, "Some alerts are invalid", AlertProcessingException.VALIDATION_ERROR));
        }
        return ResponseEntity.ok(ApiResponse.success(body));
    }
}
