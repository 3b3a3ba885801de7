package com.fightsync.domain.model;

import java.time.Instant;

/**
 * Consecutive-miss counter for an event or a fight.
 *
 * @param count    number of consecutive runs the entity was missing
 * @param lastSeen when the latest miss was recorded
 */
public record StrikeEntry(int count, Instant lastSeen) {

    public StrikeEntry increment(Instant now) {
        return new StrikeEntry(count + 1, now);
    }
}
