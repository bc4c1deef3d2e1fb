package com.irm.alert.service.persistence;

import com.irm.alert.service.ingest.AlertProcessingException;

/**
 * Exception thrown when an alert store operation fails.
 */
public class AlertStoreException extends AlertProcessingException {

    public AlertStoreException(String message, String fingerprint, Throwable cause) {
        super(message, fingerprint, PERSISTENCE_ERROR, cause);
    }

    protected AlertStoreException(String message, String fingerprint, String errorCode, Throwable cause) {
        super(message, fingerprint, errorCode, cause);
    }
}
