package com.fightsync.domain.exception;

/**
 * A catalog transaction failed and was rolled back.
 */
public class CatalogWriteException extends Exception {

    private final String eventId;

    public CatalogWriteException(String eventId, String message, Throwable cause) {
        super(message, cause);
        this.eventId = eventId;
    }

    public String getEventId() {
        return eventId;
    }
}
