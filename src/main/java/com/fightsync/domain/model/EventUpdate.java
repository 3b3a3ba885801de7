package com.fightsync.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Pending writes for one matched card. Applied in a single transaction.
 */
public class EventUpdate {

    private final String eventId;
    private final List<FieldChange> fieldChanges = new ArrayList<>();
    private final List<Fighter> fighters = new ArrayList<>();
    private final List<Fight> fightsToInsert = new ArrayList<>();
    private final List<Fight> fightsToUpdate = new ArrayList<>();
    private final List<String> fightIdsToRemove = new ArrayList<>();

    public EventUpdate(String eventId) {
        this.eventId = eventId;
    }

    public String getEventId() {
        return eventId;
    }

    public List<FieldChange> getFieldChanges() {
        return fieldChanges;
    }

    public List<Fighter> getFighters() {
        return fighters;
    }

    public List<Fight> getFightsToInsert() {
        return fightsToInsert;
    }

    public List<Fight> getFightsToUpdate() {
        return fightsToUpdate;
    }

    public List<String> getFightIdsToRemove() {
        return fightIdsToRemove;
    }

    public boolean hasFightCardChanges() {
        return !fightsToInsert.isEmpty() || !fightsToUpdate.isEmpty() || !fightIdsToRemove.isEmpty();
    }

    public boolean isEmpty() {
        return fieldChanges.isEmpty() && !hasFightCardChanges();
    }
}
