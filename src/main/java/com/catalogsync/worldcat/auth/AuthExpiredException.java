package com.catalogsync.worldcat.auth;

import com.catalogsync.worldcat.MetadataApiException;

/**
 * The service rejected the access token as expired or invalid (HTTP 401).
 */
public class AuthExpiredException extends MetadataApiException {

    public AuthExpiredException(String message) {
        super(message);
    }
}
