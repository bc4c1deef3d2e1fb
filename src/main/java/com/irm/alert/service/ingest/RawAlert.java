package com.irm.alert.service.ingest;

import java.time.Instant;
import java.util.Map;

/**
 * One alert exactly as the upstream pipeline delivered it, before validation.
 *
 * Every field may be null.
 */
public record RawAlert(
        String fingerprint,
        String status,
        Map<String, String> labels,
        Map<String, String> annotations,
        Instant startsAt,
        Instant endsAt
) {}
