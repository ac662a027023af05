package com.bbthechange.teaminvite.exception;

/**
 * Raised when team locks could not be taken or a locked team changed before commit.
 * Callers retry a bounded number of times, then defer the work to the waiting queue.
 */
public class LockConflictException extends RuntimeException {

    public LockConflictException(String message) {
        super(message);
    }

    public LockConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
