package com.catalogsync.worldcat.adapter;

import com.catalogsync.worldcat.MetadataApiException;

/**
 * The request could not be completed: connection refused, DNS failure or timeout.
 */
public class ConnectionFailureException extends MetadataApiException {

    public ConnectionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
