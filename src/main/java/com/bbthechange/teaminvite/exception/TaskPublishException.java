package com.bbthechange.teaminvite.exception;

/**
 * A dispatch task could not be handed to the task transport.
 */
public class TaskPublishException extends RuntimeException {

    public TaskPublishException(String message) {
        super(message);
    }

    public TaskPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
