package com.fightsync.domain.model;

/**
 * Rows touched by one catalog transaction.
 */
public record WriteCounts(int fightersAdded, int fightsAdded, int fightsUpdated, int fightsRemoved) {

    public static final WriteCounts NONE = new WriteCounts(0, 0, 0, 0);

    public WriteCounts plus(WriteCounts other) {
        return new WriteCounts(
            fightersAdded + other.fightersAdded,
            fightsAdded + other.fightsAdded,
            fightsUpdated + other.fightsUpdated,
            fightsRemoved + other.fightsRemoved
        );
    }
}
