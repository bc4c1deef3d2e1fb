package com.irm.alert.service.persistence;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Interface for the alert store.
 *
 * Durable source of truth for alert state, keyed by fingerprint.
 * Implementations must enforce fingerprint uniqueness on insert.
 */
public interface AlertStore {

    /**
     * Looks up an alert by fingerprint.
     *
     * @param fingerprint the alert fingerprint
     * @return the record if found
     * @throws AlertStoreException if the store cannot be read
     */
    Optional<AlertRecord> findByFingerprint(String fingerprint);

    /**
     * Inserts a new alert.
     *
     * @param record the record to insert, id ignored
     * @return the record with its store-assigned id
     * @throws DuplicateFingerprintException if the fingerprint is already present
     * @throws AlertStoreException on any other store failure
     */
    AlertRecord insert(AlertRecord record);

    /**
     * Updates the status and end time of an existing alert. No other field changes.
     *
     * @param id the store-assigned id
     * @param status the new status
     * @param endsAt the new end time, null when unset
     * @throws AlertStoreException if the update fails or the record no longer exists
     */
    void updateStatusAndEndsAt(long id, String status, Instant endsAt);

    /**
     * Lists alerts, most recently created first.
     *
     * @param status only alerts with this status, or all when null
     * @param limit maximum number of records
     * @return matching records
     */
    List<AlertRecord> findAll(String status, int limit);

    /**
     * Gets the number of stored alerts.
     *
     * @return number of alerts
     */
    long count();

    /**
     * Checks whether the store is reachable.
     *
     * @return true if reachable
     */
    boolean isAvailable();
}
