package com.catalogsync.common;

/**
 * Thrown when a single input row carries an unusable identifier. Row-local: the row is
 * recorded as an error and the run continues.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
