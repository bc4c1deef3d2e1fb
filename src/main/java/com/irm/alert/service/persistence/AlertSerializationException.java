package com.irm.alert.service.persistence;

import com.irm.alert.service.ingest.AlertProcessingException;

/**
 * Thrown when labels or annotations cannot be encoded for storage or decoded from it.
 */
public class AlertSerializationException extends AlertProcessingException {

    public AlertSerializationException(String message, String fingerprint, Throwable cause) {
        super(message, fingerprint, SERIALIZATION_ERROR, cause);
    }
}
