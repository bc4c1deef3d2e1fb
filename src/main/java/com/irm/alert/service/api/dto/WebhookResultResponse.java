package com.irm.alert.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.irm.alert.service.engine.BatchResult;
import com.irm.alert.service.engine.EventOutcome;
import com.irm.alert.service.engine.OutcomeType;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Response DTO for a processed webhook batch.
 */
public record WebhookResultResponse(
        int received,
        long created,
        long updated,
        long duplicate,
        long errors,
        List<OutcomeResponse> outcomes
) {

    public static WebhookResultResponse from(BatchResult result) {
        List<OutcomeResponse> outcomes = IntStream.range(0, result.size())
                .mapToObj(i -> OutcomeResponse.from(i, result.get(i)))
                .toList();
        return new WebhookResultResponse(
                result.size(),
                result.count(OutcomeType.NEW),
                result.count(OutcomeType.UPDATED),
                result.count(OutcomeType.DUPLICATE),
                result.count(OutcomeType.ERROR),
                outcomes
        );
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record OutcomeResponse(
            int position,
            String fingerprint,
            OutcomeType outcome,
            String errorCode,
            String message
    ) {
        static OutcomeResponse from(int position, EventOutcome outcome) {
            return new OutcomeResponse(
                    position,
                    outcome.fingerprint(),
                    outcome.type(),
                    outcome.errorCode(),
                    outcome.message()
            );
        }
    }
}
