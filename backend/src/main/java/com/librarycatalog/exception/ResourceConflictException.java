package com.librarycatalog.exception;

/**
 * The request clashes with existing data (duplicate key, dependent rows).
 */
public class ResourceConflictException extends RuntimeException {

    public ResourceConflictException(String message) {
        super(message);
    }
}
