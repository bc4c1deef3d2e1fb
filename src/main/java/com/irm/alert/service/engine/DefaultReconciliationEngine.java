package com.irm.alert.service.engine;

import com.irm.alert.service.config.AlertServiceConfig;
import com.irm.alert.service.ingest.AlertEvent;
import com.irm.alert.service.ingest.AlertProcessingException;
import com.irm.alert.service.persistence.AlertPayloadSerializer;
import com.irm.alert.service.persistence.AlertRecord;
import com.irm.alert.service.persistence.AlertStore;
import com.irm.alert.service.persistence.DuplicateFingerprintException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Default implementation of ReconciliationEngine.
 *
 * Every lookup goes to the store; nothing is cached between calls. Status
 * equality is the only duplicate test, so a retransmitted notification
 * writes nothing, not even its end time. Labels and annotations are
 * recorded on first insert and never refreshed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DefaultReconciliationEngine implements ReconciliationEngine {

    private final AlertStore alertStore;
    private final AlertPayloadSerializer payloadSerializer;
    private final OutcomeReporter outcomeReporter;
    private final AlertServiceConfig config;
    private final Clock clock;

    @Override
    public BatchResult reconcile(List<AlertEvent> events) {
        List<EventOutcome> outcomes = events.stream()
                .map(this::reconcile)
                .toList();
        return new BatchResult(outcomes);
    }

    @Override
    public EventOutcome reconcile(AlertEvent event) {
        EventOutcome outcome;
        try {
            outcome = alertStore.findByFingerprint(event.fingerprint())
                    .map(existing -> applyToExisting(event, existing))
                    .orElseGet(() -> insertNew(event));
        } catch (AlertProcessingException e) {
            log.warn("Failed to reconcile alert: fingerprint={}, error={} [{}]",
                    event.fingerprint(), e.getMessage(), e.getErrorCode());
            outcome = EventOutcome.error(event.fingerprint(), e);
        }
        report(outcome);
        return outcome;
    }

    // ==================== Decisions ====================

    private EventOutcome insertNew(AlertEvent event) {
        String fingerprint = event.fingerprint();
        AlertRecord record = new AlertRecord(
                null,
                fingerprint,
                event.status(),
                payloadSerializer.serialize(fingerprint, event.labels()),
                payloadSerializer.serialize(fingerprint, event.annotations()),
                event.startsAt(),
                event.endsAt(),
                Instant.now(clock)
        );

        try {
            AlertRecord stored = alertStore.insert(record);
            log.info("New alert recorded: fingerprint={}, id={}, status={}",
                    fingerprint, stored.id(), stored.status());
            return EventOutcome.of(fingerprint, OutcomeType.NEW);
        } catch (DuplicateFingerprintException e) {
            return resolveInsertRace(event, e);
        }
    }

    private EventOutcome applyToExisting(AlertEvent event, AlertRecord existing) {
        if (Objects.equals(existing.status(), event.status())) {
            log.debug("Duplicate alert: fingerprint={}, status={}", event.fingerprint(), event.status());
            return EventOutcome.of(event.fingerprint(), OutcomeType.DUPLICATE);
        }

        alertStore.updateStatusAndEndsAt(existing.id(), event.status(), event.endsAt());
        log.info("Alert status changed: fingerprint={}, {} -> {}",
                event.fingerprint(), existing.status(), event.status());
        return EventOutcome.of(event.fingerprint(), OutcomeType.UPDATED);
    }

    /**
     * Another batch inserted the fingerprint between our lookup and our insert.
     */
    private EventOutcome resolveInsertRace(AlertEvent event, DuplicateFingerprintException e) {
        if (config.getReconcile().getDuplicateKeyPolicy() == DuplicateKeyPolicy.REPORT_ERROR) {
            log.warn("Lost insert race, reporting error: fingerprint={}", event.fingerprint());
            return EventOutcome.error(event.fingerprint(), e);
        }

        Optional<AlertRecord> winner = alertStore.findByFingerprint(event.fingerprint());
        if (winner.isEmpty()) {
            log.warn("Lost insert race but record is gone: fingerprint={}", event.fingerprint());
            return EventOutcome.error(event.fingerprint(), e);
        }
        log.info("Lost insert race, reconciling against stored alert: fingerprint={}", event.fingerprint());
        return applyToExisting(event, winner.get());
    }

    private void report(EventOutcome outcome) {
        switch (outcome.type()) {
            case NEW -> outcomeReporter.incrementNew();
            case UPDATED -> outcomeReporter.incrementUpdated();
            case DUPLICATE -> outcomeReporter.incrementDuplicate();
            case ERROR -> outcomeReporter.incrementFailed(outcome.errorCode());
        }
    }
}
