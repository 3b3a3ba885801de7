package com.fightsync.domain.exception;

/**
 * A source could not deliver its upcoming cards.
 */
public class SourceException extends Exception {

    private final String sourceName;

    public SourceException(String sourceName, String message) {
        super(message);
        this.sourceName = sourceName;
    }

    public SourceException(String sourceName, String message, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
