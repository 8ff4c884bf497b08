package com.catalogsync.worldcat.buffer;

/**
 * Thrown when an identifier is added to a buffer that already holds it (or when a single-record
 * buffer is not empty). Means the driver failed to dedupe before adding; fatal.
 */
public class DuplicateIdentifierException extends IllegalStateException {

    public DuplicateIdentifierException(String message) {
        super(message);
    }
}
