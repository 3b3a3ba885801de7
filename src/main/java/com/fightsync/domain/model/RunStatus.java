package com.fightsync.domain.model;

/**
 * Final state of a reconciliation run as recorded in the audit trail.
 */
public enum RunStatus {
    RUNNING,
    /** Every source fetched and every event processed. */
    SUCCESS,
    /** Completed, but at least one source or event failed. */
    PARTIAL,
    /** A source reported a block; nothing was written. */
    BLOCKED,
    FAILED
}
