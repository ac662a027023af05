package com.bbthechange.teaminvite.exception;

/**
 * The membership service rejected the request for good. Never retried.
 */
public class TerminalExternalFailureException extends RuntimeException {

    public TerminalExternalFailureException(String message) {
        super(message);
    }

    public TerminalExternalFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
