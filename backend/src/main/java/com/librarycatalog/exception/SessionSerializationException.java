package com.librarycatalog.exception;

/**
 * Thrown when a session is bound to a principal that was never stored.
 */
public class SessionSerializationException extends RuntimeException {

    public SessionSerializationException(String message) {
        super(message);
    }
}
