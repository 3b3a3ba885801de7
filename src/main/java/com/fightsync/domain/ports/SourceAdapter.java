package com.fightsync.domain.ports;

import com.fightsync.domain.exception.SourceException;
import com.fightsync.domain.model.SourcePayload;

/**
 * Port for fetching upcoming cards from one external source.
 */
public interface SourceAdapter {

    /**
     * Gets the name of the source this adapter reads.
     *
     * @return Source name (e.g., "sherdog", "tapology")
     */
    String getSourceName();

    /**
     * Fetches upcoming cards with their fight cards and fighters.
     *
     * @param limit maximum number of cards to return
     * @return the source's payload, possibly empty
     * @throws com.fightsync.domain.exception.SourceBlockedException if the source refused access
     * @throws SourceException on any other failure
     */
    SourcePayload fetchUpcoming(int limit) throws SourceException;
}
