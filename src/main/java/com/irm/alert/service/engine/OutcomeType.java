package com.irm.alert.service.engine;

/**
 * Classification of one reconciled alert event.
 */
public enum OutcomeType {
    /** First sighting of the fingerprint; a record was inserted. */
    NEW,
    /** Known fingerprint with a different status; status and end time were updated. */
    UPDATED,
    /** Known fingerprint with the same status; nothing was written. */
    DUPLICATE,
    /** The event could not be reconciled; see the error code. */
    ERROR
}
