package com.catalogsync.worldcat.classifier;

import com.catalogsync.worldcat.MetadataApiException;

/**
 * A 2xx response body could not be parsed, or lacks the fields classification needs.
 * Never recovered from: a later request would likely fail the same way.
 */
public class MalformedResponseException extends MetadataApiException {

    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
