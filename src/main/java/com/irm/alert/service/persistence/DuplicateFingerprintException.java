package com.irm.alert.service.persistence;

/**
 * Thrown by {@link AlertStore#insert} when another record already holds the fingerprint.
 *
 * Typically the losing side of two batches inserting the same new alert concurrently.
 */
public class DuplicateFingerprintException extends AlertStoreException {

    public DuplicateFingerprintException(String fingerprint, Throwable cause) {
        super("Alert already exists: " + fingerprint, fingerprint, DUPLICATE_KEY, cause);
    }
}
