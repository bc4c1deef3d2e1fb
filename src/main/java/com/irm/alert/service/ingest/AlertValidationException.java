package com.irm.alert.service.ingest;

/**
 * Thrown when a raw alert is missing a field the service cannot do without.
 */
public class AlertValidationException extends AlertProcessingException {

    public AlertValidationException(String message, String fingerprint) {
        super(message, fingerprint, VALIDATION_ERROR);
    }
}
