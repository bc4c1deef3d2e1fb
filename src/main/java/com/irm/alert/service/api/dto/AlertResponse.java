package com.irm.alert.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Response DTO for one stored alert.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AlertResponse {

    private Long id;
    private String fingerprint;
    private String status;
    private Map<String, String> labels;
    private Map<String, String> annotations;
    private Instant startsAt;

    /**
     * Absent while the alert is still open.
     */
    private Instant endsAt;

    private Instant createdAt;
}
