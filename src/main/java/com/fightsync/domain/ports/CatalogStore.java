package com.fightsync.domain.ports;

import com.fightsync.domain.exception.CatalogUnavailableException;
import com.fightsync.domain.exception.CatalogWriteException;
import com.fightsync.domain.model.Event;
import com.fightsync.domain.model.EventUpdate;
import com.fightsync.domain.model.NewEventWrite;
import com.fightsync.domain.model.WriteCounts;

import java.time.LocalDate;
import java.util.List;

/**
 * Port for the persisted event/fight/fighter catalog.
 */
public interface CatalogStore {

    /**
     * Loads every non-completed event dated on or after {@code from}, with its
     * fights and fighter names, ordered by date.
     */
    List<Event> findUpcomingEvents(LocalDate from) throws CatalogUnavailableException;

    /**
     * Creates a card atomically: fighters upserted first, then the event, then
     * its fights (duplicates skipped). Nothing persists if any step fails.
     */
    WriteCounts createEvent(NewEventWrite write) throws CatalogWriteException;

    /**
     * Applies field changes, fighter upserts and fight-card changes of one
     * event in a single transaction. Prediction fields of existing fights are
     * never written.
     */
    WriteCounts applyEventUpdate(EventUpdate update) throws CatalogWriteException;

    /**
     * Marks an event completed, which is how a cancellation is stored.
     */
    void markEventCompleted(String eventId) throws CatalogWriteException;
}
