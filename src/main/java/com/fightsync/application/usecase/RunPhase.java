package com.fightsync.application.usecase;

/**
 * Phases of a reconciliation run. {@link #BLOCKED_SKIP} is terminal and only
 * reachable from {@link #FETCHING}.
 */
public enum RunPhase {
    FETCHING,
    VALIDATING,
    MATCHING,
    DIFFING,
    WRITING,
    LEDGER_PERSIST,
    DONE,
    BLOCKED_SKIP,
    ABORTED
}
