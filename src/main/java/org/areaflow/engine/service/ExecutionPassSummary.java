package org.areaflow.engine.service;

import java.util.Map;

/**
 * Outcome counts of one manual execution pass over all active areas.
 */
public record ExecutionPassSummary(int areasChecked, Map<TickOutcome, Integer> outcomes) {

    public ExecutionPassSummary {
        outcomes = Map.copyOf(outcomes);
    }

    public int count(TickOutcome outcome) {
        return outcomes.getOrDefault(outcome, 0);
    }
}
