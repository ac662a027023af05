package com.bbthechange.teaminvite.exception;

/**
 * Wraps seat-store failures that are not lock conflicts.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
