package com.catalogsync.worldcat;

/**
 * Thrown when a WorldCat Metadata API or token endpoint call fails.
 */
public class MetadataApiException extends RuntimeException {

    public MetadataApiException(String message) {
        super(message);
    }

    public MetadataApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
