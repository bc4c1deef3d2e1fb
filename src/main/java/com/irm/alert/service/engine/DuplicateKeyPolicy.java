package com.irm.alert.service.engine;

/**
 * How the engine resolves an insert that lost the race against a concurrent batch
 * for the same fingerprint.
 */
public enum DuplicateKeyPolicy {

    /**
     * Re-read the record the other batch inserted and reconcile against it,
     * yielding UPDATED or DUPLICATE.
     */
    RETRY_AS_UPDATE,

    /**
     * Report the event as ERROR with code DUPLICATE_KEY; the sender is expected to retry.
     */
    REPORT_ERROR
}
