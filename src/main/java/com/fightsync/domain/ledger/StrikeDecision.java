package com.fightsync.domain.ledger;

/**
 * Result of recording one miss.
 *
 * @param count     consecutive misses including this one
 * @param threshold misses required before the destructive action
 */
public record StrikeDecision(int count, int threshold) {

    public boolean thresholdReached() {
        return count >= threshold;
    }
}
