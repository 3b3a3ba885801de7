package com.fightsync.domain.ledger;

import com.fightsync.domain.model.StrikeEntry;
import com.fightsync.domain.ports.StrikeLedgerStore;

import java.time.Instant;

/**
 * Gatekeeper for destructive actions on entities missing from a scrape.
 *
 * A miss increments the entity's counter. Below the threshold the caller
 * only warns; at the threshold it acts and then calls {@code consume*} so
 * the strikes are spent. Any reappearance clears the counter outright.
 */
public class StrikeLedger {

    private final StrikeLedgerStore store;
    private final int eventThreshold;
    private final int fightThreshold;

    public StrikeLedger(StrikeLedgerStore store, int eventThreshold, int fightThreshold) {
        if (eventThreshold < 1 || fightThreshold < 1) {
            throw new IllegalArgumentException("Thresholds must be at least 1");
        }
        this.store = store;
        this.eventThreshold = eventThreshold;
        this.fightThreshold = fightThreshold;
    }

    public StrikeDecision recordEventMiss(String eventId, Instant now) {
        StrikeEntry entry = store.getEvent(eventId)
            .map(existing -> existing.increment(now))
            .orElseGet(() -> new StrikeEntry(1, now));
        store.setEvent(eventId, entry);
        return new StrikeDecision(entry.count(), eventThreshold);
    }

    public StrikeDecision recordFightMiss(String eventId, String fightKey, Instant now) {
        StrikeEntry entry = store.getFight(eventId, fightKey)
            .map(existing -> existing.increment(now))
            .orElseGet(() -> new StrikeEntry(1, now));
        store.setFight(eventId, fightKey, entry);
        return new StrikeDecision(entry.count(), fightThreshold);
    }

    /**
     * Resets an event that showed up again.
     *
     * @return true if the event had outstanding strikes
     */
    public boolean clearEvent(String eventId) {
        return store.deleteEvent(eventId);
    }

    public boolean clearFight(String eventId, String fightKey) {
        return store.deleteFight(eventId, fightKey);
    }

    /**
     * Spends an event's strikes after it was cancelled. Its fight entries go
     * with it.
     */
    public void consumeEvent(String eventId) {
        store.deleteEvent(eventId);
        store.deleteFightsForEvent(eventId);
    }

    public void consumeFight(String eventId, String fightKey) {
        store.deleteFight(eventId, fightKey);
    }

    public int getEventThreshold() {
        return eventThreshold;
    }

    public int getFightThreshold() {
        return fightThreshold;
    }
}
