package com.bbthechange.chatpolls.exception;

/**
 * Exception thrown when an operation needs the message a poll belongs to,
 * but the poll (or one of its answers) was built locally and never attached.
 *
 * Re-fetch the message and use its poll instead.
 */
public class UnattachedResourceException extends RuntimeException {

    public UnattachedResourceException(String message) {
        super(message);
    }
}
