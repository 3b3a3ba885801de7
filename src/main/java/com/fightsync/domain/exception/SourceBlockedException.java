package com.fightsync.domain.exception;

/**
 * The source actively refused us (access denied, rate limited, challenge page).
 * Unlike a plain {@link SourceException} this says nothing about whether the
 * cards still exist, so no absence may be inferred from it.
 */
public class SourceBlockedException extends SourceException {

    private final int statusCode;

    public SourceBlockedException(String sourceName, int statusCode, String message) {
        super(sourceName, message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
