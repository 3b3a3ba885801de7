package com.fightsync.application.usecase;

import com.fightsync.domain.model.CatalogChange;
import com.fightsync.domain.model.RunStatus;

import java.util.List;
import java.util.Map;

/**
 * Summary of a reconciliation run. Counts are filled in even when the run
 * failed part-way.
 */
public record ReconciliationSummary(
    String runId,
    RunStatus status,
    RunPhase finalPhase,
    int eventsProcessed,
    int fightsProcessed,
    Map<String, Integer> eventsBySource,
    List<CatalogChange> changes,
    List<EventOutcome> outcomes,
    List<String> warnings,
    List<String> errors,
    long executionTimeMs
) {

    public long failedCount() {
        return outcomes.stream().filter(EventOutcome::isFailed).count();
    }
}
