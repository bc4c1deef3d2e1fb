package com.irm.alert.service.ingest;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical alert event consumed by the reconciliation engine.
 *
 * Fingerprint is never blank, status and maps are never null.
 * A null {@code startsAt} or {@code endsAt} means the timestamp is unset.
 */
public record AlertEvent(
        String fingerprint,
        String status,
        Map<String, String> labels,
        Map<String, String> annotations,
        Instant startsAt,
        Instant endsAt
) {

    public AlertEvent {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(status, "status");
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        annotations = annotations == null ? Map.of() : Map.copyOf(annotations);
    }
}
