package com.irm.alert.service.engine;

import com.irm.alert.service.ingest.AlertProcessingException;

/**
 * Result of reconciling a single alert event.
 *
 * {@code errorCode} and {@code message} are only set for {@link OutcomeType#ERROR}.
 */
public record EventOutcome(
        String fingerprint,
        OutcomeType type,
        String errorCode,
        String message
) {

    public static EventOutcome of(String fingerprint, OutcomeType type) {
        return new EventOutcome(fingerprint, type, null, null);
    }

    public static EventOutcome error(String fingerprint, AlertProcessingException cause) {
        return new EventOutcome(fingerprint, OutcomeType.ERROR, cause.getErrorCode(), cause.getMessage());
    }

    public boolean isError() {
        return type == OutcomeType.ERROR;
    }
}
