package com.fightsync.domain.exception;

/**
 * Thrown when a reconciliation run is requested while another one is active.
 */
public class RunInProgressException extends RuntimeException {

    public RunInProgressException(String message) {
        super(message);
    }
}
