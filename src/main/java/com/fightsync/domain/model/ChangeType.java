package com.fightsync.domain.model;

/**
 * Kinds of catalog change a reconciliation run can make.
 */
public enum ChangeType {
    ADDED,
    MODIFIED,
    CANCELLED,
    FIGHT_REMOVED
}
