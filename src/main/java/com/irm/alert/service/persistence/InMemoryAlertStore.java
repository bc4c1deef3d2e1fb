package com.irm.alert.service.persistence;

import com.irm.alert.service.config.MetricsConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of AlertStore.
 *
 * Thread-safe using ConcurrentHashMap. Fingerprint uniqueness is enforced
 * atomically with {@code putIfAbsent}, so it loses races the same way the
 * database does. Contents are lost on restart.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "irm.store", name = "type", havingValue = "memory")
public class InMemoryAlertStore implements AlertStore {

    /**
     * Same order as the JDBC store: {@code created_at desc, id desc}.
     */
    private static final Comparator<AlertRecord> NEWEST_FIRST = Comparator
            .<AlertRecord, Instant>comparing(AlertRecord::createdAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(AlertRecord::id)
            .reversed();

    private final MetricsConfig metricsConfig;

    private final Map<String, AlertRecord> alerts = new ConcurrentHashMap<>();
    private final Map<Long, String> fingerprintsById = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @PostConstruct
    void init() {
        metricsConfig.registerStoreGauge(
                "irm.alerts.stored",
                "Number of alerts in the store",
                this::count
        );
        log.info("InMemoryAlertStore initialized");
    }

    @Override
    public Optional<AlertRecord> findByFingerprint(String fingerprint) {
        return Optional.ofNullable(alerts.get(fingerprint));
    }

    @Override
    public AlertRecord insert(AlertRecord record) {
        long id = sequence.incrementAndGet();
        AlertRecord stored = record.withId(id);

        // The id must resolve before the record becomes visible to other lookups.
        fingerprintsById.put(id, record.fingerprint());
        AlertRecord existing = alerts.putIfAbsent(record.fingerprint(), stored);
        if (existing != null) {
            fingerprintsById.remove(id);
            throw new DuplicateFingerprintException(record.fingerprint(), null);
        }
        log.debug("Alert inserted: id={}, fingerprint={}", id, record.fingerprint());
        return stored;
    }

    @Override
    public void updateStatusAndEndsAt(long id, String status, Instant endsAt) {
        String fingerprint = fingerprintsById.get(id);
        AlertRecord updated = fingerprint == null
                ? null
                : alerts.computeIfPresent(fingerprint, (fp, current) -> current.withStatus(status, endsAt));
        if (updated == null) {
            throw new AlertStoreException("Alert not found for update: id=" + id, fingerprint, null);
        }
        log.debug("Alert updated: id={}, fingerprint={}, status={}", id, fingerprint, status);
    }

    @Override
    public List<AlertRecord> findAll(String status, int limit) {
        return alerts.values().stream()
                .filter(record -> status == null || status.equals(record.status()))
                .sorted(NEWEST_FIRST)
                .limit(limit)
                .toList();
    }

    @Override
    public long count() {
        return alerts.size();
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    /**
     * Removes every alert. Retention is owned elsewhere; this exists for tests and local runs.
     */
    public void clear() {
        alerts.clear();
        fingerprintsById.clear();
        log.info("InMemoryAlertStore cleared");
    }
}
