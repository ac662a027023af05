package com.bbthechange.teaminvite.exception;

/**
 * The coordination service (semaphore, counters, mutex) could not be reached.
 * Each caller decides whether that means fail-open or fail-closed.
 */
public class CoordinationUnavailableException extends RuntimeException {

    public CoordinationUnavailableException(String message) {
        super(message);
    }

    public CoordinationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
