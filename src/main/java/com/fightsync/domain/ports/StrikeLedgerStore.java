package com.fightsync.domain.ports;

import com.fightsync.domain.model.StrikeEntry;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * Key-value storage for miss counters. Event entries are keyed by event id,
 * fight entries by event id and fighter-pair key.
 *
 * Reads and writes work on in-memory state; nothing is durable until
 * {@link #flush()} succeeds.
 */
public interface StrikeLedgerStore {

    /**
     * Replaces in-memory state with what is currently persisted.
     */
    void load() throws IOException;

    Optional<StrikeEntry> getEvent(String eventId);

    void setEvent(String eventId, StrikeEntry entry);

    boolean deleteEvent(String eventId);

    Optional<StrikeEntry> getFight(String eventId, String fightKey);

    void setFight(String eventId, String fightKey, StrikeEntry entry);

    boolean deleteFight(String eventId, String fightKey);

    /**
     * Drops every fight entry recorded under an event.
     */
    void deleteFightsForEvent(String eventId);

    /**
     * @return read-only snapshot of event entries
     */
    Map<String, StrikeEntry> eventEntries();

    /**
     * @return read-only snapshot of fight entries grouped by event id
     */
    Map<String, Map<String, StrikeEntry>> fightEntries();

    void flush() throws IOException;
}
