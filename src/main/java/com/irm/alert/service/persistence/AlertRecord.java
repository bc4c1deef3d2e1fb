package com.irm.alert.service.persistence;

import java.time.Instant;

/**
 * Persistent state of one alert, unique per fingerprint.
 *
 * {@code labels} and {@code annotations} hold JSON objects captured at first insert.
 * Only {@code status} and {@code endsAt} change afterwards.
 */
public record AlertRecord(
        Long id,
        String fingerprint,
        String status,
        String labels,
        String annotations,
        Instant startsAt,
        Instant endsAt,
        Instant createdAt
) {

    /**
     * Copy with the store-assigned id.
     */
    public AlertRecord withId(Long newId) {
        return new AlertRecord(newId, fingerprint, status, labels, annotations, startsAt, endsAt, createdAt);
    }

    /**
     * Copy after a status transition.
     */
    public AlertRecord withStatus(String newStatus, Instant newEndsAt) {
        return new AlertRecord(id, fingerprint, newStatus, labels, annotations, startsAt, newEndsAt, createdAt);
    }
}
