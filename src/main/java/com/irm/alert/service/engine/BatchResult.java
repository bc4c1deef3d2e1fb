package com.irm.alert.service.engine;

import java.util.List;

/**
 * Ordered per-event outcomes of one batch. The outcome at index {@code i}
 * belongs to the event at index {@code i} of the submitted batch.
 */
public record BatchResult(List<EventOutcome> outcomes) {

    public BatchResult {
        outcomes = List.copyOf(outcomes);
    }

    public int size() {
        return outcomes.size();
    }

    public EventOutcome get(int position) {
        return outcomes.get(position);
    }

    public long count(OutcomeType type) {
        return outcomes.stream()
                .filter(outcome -> outcome.type() == type)
                .count();
    }

    public long countErrors(String errorCode) {
        return outcomes.stream()
                .filter(outcome -> outcome.isError() && errorCode.equals(outcome.errorCode()))
                .count();
    }

    public boolean hasErrors() {
        return outcomes.stream().anyMatch(EventOutcome::isError);
    }

    /**
     * Checks for failures caused by something other than the given error code.
     */
    public boolean hasErrorsOtherThan(String errorCode) {
        return outcomes.stream()
                .anyMatch(outcome -> outcome.isError() && !errorCode.equals(outcome.errorCode()));
    }
}
