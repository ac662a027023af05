package com.bbthechange.teaminvite.exception;

/**
 * Thrown when a table key component (team id, identity, redeem code) is malformed.
 */
public class InvalidKeyException extends RuntimeException {

    public InvalidKeyException(String message) {
        super(message);
    }

    public InvalidKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
