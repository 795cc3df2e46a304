package com.librarycatalog.exception;

/**
 * The password hashing primitive failed. A credential mismatch is never
 * reported this way.
 */
public class HashingException extends RuntimeException {

    public HashingException(String message, Throwable cause) {
        super(message, cause);
    }
}
