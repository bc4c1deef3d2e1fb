package com.irm.alert.service.ingest;

/**
 * Interface for turning raw webhook alerts into canonical alert events.
 */
public interface AlertEventNormalizer {

    /**
     * Validates and normalizes one raw alert.
     *
     * @param raw the alert as delivered
     * @return the canonical event
     * @throws AlertValidationException if the fingerprint is missing or blank
     */
    AlertEvent normalize(RawAlert raw);
}
