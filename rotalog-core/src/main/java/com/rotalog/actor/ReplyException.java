package com.rotalog.actor;

/**
 * Exception thrown when a reply completed with a checked exception or the wait was interrupted.
 */
public class ReplyException extends RuntimeException {

    public ReplyException(String message, Throwable cause) {
        super(message, cause);
    }
}
