package com.irm.alert.service.engine;

import com.irm.alert.service.ingest.AlertEvent;

import java.util.List;

/**
 * Interface for the alert reconciliation engine.
 *
 * Decides per fingerprint whether an event is a new alert, a status
 * transition, or a duplicate, and applies it to the alert store.
 * Failures are returned as ERROR outcomes, never thrown.
 */
public interface ReconciliationEngine {

    /**
     * Reconciles a batch sequentially, in input order.
     *
     * @param events the normalized events
     * @return one outcome per event, in the same order
     */
    BatchResult reconcile(List<AlertEvent> events);

    /**
     * Reconciles a single event.
     *
     * @param event the normalized event
     * @return the outcome
     */
    EventOutcome reconcile(AlertEvent event);
}
