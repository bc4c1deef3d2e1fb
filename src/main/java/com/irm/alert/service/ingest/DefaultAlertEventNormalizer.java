package com.irm.alert.service.ingest;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default implementation of AlertEventNormalizer.
 *
 * Only the fingerprint is mandatory. A missing status becomes the empty string,
 * missing maps become empty, and Alertmanager's zero time ({@code 0001-01-01T00:00:00Z})
 * is treated as unset.
 */
@Component
public class DefaultAlertEventNormalizer implements AlertEventNormalizer {

    static final Instant ZERO_TIME = Instant.parse("0001-01-01T00:00:00Z");

    @Override
    public AlertEvent normalize(RawAlert raw) {
        if (raw == null) {
            throw new AlertValidationException("alert is null", null);
        }
        String fingerprint = raw.fingerprint();
        if (fingerprint == null || fingerprint.isBlank()) {
            throw new AlertValidationException("fingerprint is required", fingerprint);
        }

        return new AlertEvent(
                fingerprint,
                raw.status() != null ? raw.status() : "",
                withoutNulls(raw.labels()),
                withoutNulls(raw.annotations()),
                unsetIfZero(raw.startsAt()),
                unsetIfZero(raw.endsAt())
        );
    }

    private static Map<String, String> withoutNulls(Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, String> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return copy;
    }

    private static Instant unsetIfZero(Instant timestamp) {
        if (timestamp == null || !timestamp.isAfter(ZERO_TIME)) {
            return null;
        }
        return timestamp;
    }
}
