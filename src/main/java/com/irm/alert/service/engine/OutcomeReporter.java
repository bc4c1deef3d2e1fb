package com.irm.alert.service.engine;

/**
 * Sink for reconciliation outcome counts.
 *
 * Implementations are best-effort: they must never throw into the caller.
 */
public interface OutcomeReporter {

    /**
     * Records that a batch of alerts arrived.
     *
     * @param count number of alerts in the batch, valid or not
     */
    void incrementReceived(int count);

    void incrementNew();

    void incrementDuplicate();

    void incrementUpdated();

    /**
     * Records an alert that could not be reconciled.
     *
     * @param errorCode the failure's error code
     */
    void incrementFailed(String errorCode);
}
