package com.irm.alert.service.ingest;

import com.irm.alert.service.config.MetricsConfig;
import com.irm.alert.service.engine.BatchResult;
import com.irm.alert.service.engine.EventOutcome;
import com.irm.alert.service.engine.OutcomeType;
import com.irm.alert.service.engine.OutcomeReporter;
import com.irm.alert.service.engine.ReconciliationEngine;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Processes one webhook batch end to end.
 *
 * Counts the received alerts, normalizes each one and hands valid events to the
 * reconciliation engine. An invalid alert occupies its own slot in the result as a
 * VALIDATION_ERROR outcome; the rest of the batch is still processed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertWebhookService {

    private final AlertEventNormalizer normalizer;
    private final ReconciliationEngine engine;
    private final OutcomeReporter outcomeReporter;
    private final MetricsConfig metricsConfig;

    public BatchResult process(List<RawAlert> alerts) {
        outcomeReporter.incrementReceived(alerts.size());
        Timer.Sample sample = Timer.start(metricsConfig.getRegistry());
        BatchResult result;
        try {
            result = reconcileAll(alerts);
        } finally {
            sample.stop(metricsConfig.getBatchTimer());
        }

        log.info("Webhook batch processed: received={}, new={}, updated={}, duplicate={}, errors={}",
                result.size(),
                result.count(OutcomeType.NEW),
                result.count(OutcomeType.UPDATED),
                result.count(OutcomeType.DUPLICATE),
                result.count(OutcomeType.ERROR));
        return result;
    }

    private BatchResult reconcileAll(List<RawAlert> alerts) {
        List<EventOutcome> outcomes = new ArrayList<>(alerts.size());
        for (RawAlert raw : alerts) {
            outcomes.add(reconcileOne(raw));
        }
        return new BatchResult(outcomes);
    }

    private EventOutcome reconcileOne(RawAlert raw) {
        AlertEvent event;
        try {
            event = normalizer.normalize(raw);
        } catch (AlertValidationException e) {
            log.warn("Rejected alert: {}", e.getMessage());
            outcomeReporter.incrementFailed(e.getErrorCode());
            return EventOutcome.error(e.getFingerprint(), e);
        }
        return engine.reconcile(event);
    }
}
