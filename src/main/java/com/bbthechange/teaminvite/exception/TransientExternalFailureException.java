package com.bbthechange.teaminvite.exception;

/**
 * The membership service failed in a way worth retrying: timeouts, rate limits, 5xx.
 */
public class TransientExternalFailureException extends RuntimeException {

    public TransientExternalFailureException(String message) {
        super(message);
    }

    public TransientExternalFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
