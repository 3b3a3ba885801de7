package com.fightsync.domain.exception;

/**
 * The current catalog state could not be read. A run must not write anything
 * without that baseline.
 */
public class CatalogUnavailableException extends Exception {

    public CatalogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
