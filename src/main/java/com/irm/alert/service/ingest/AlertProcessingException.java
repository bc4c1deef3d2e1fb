package com.irm.alert.service.ingest;

/**
 * Base exception for failures while processing a single alert.
 *
 * Carries the fingerprint of the affected alert (when known) and a stable
 * error code that ends up in the per-event slot of a batch result.
 */
public class AlertProcessingException extends RuntimeException {

    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String PERSISTENCE_ERROR = "PERSISTENCE_ERROR";
    public static final String DUPLICATE_KEY = "DUPLICATE_KEY";
    public static final String SERIALIZATION_ERROR = "SERIALIZATION_ERROR";

    private final String fingerprint;
    private final String errorCode;

    public AlertProcessingException(String message, String fingerprint, String errorCode) {
        super(message);
        this.fingerprint = fingerprint;
        this.errorCode = errorCode;
    }

    public AlertProcessingException(String message, String fingerprint, String errorCode, Throwable cause) {
        super(message, cause);
        this.fingerprint = fingerprint;
        this.errorCode = errorCode;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
