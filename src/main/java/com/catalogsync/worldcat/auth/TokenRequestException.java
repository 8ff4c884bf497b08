package com.catalogsync.worldcat.auth;

import com.catalogsync.worldcat.MetadataApiException;

/**
 * The token endpoint failed to issue credentials.
 */
public class TokenRequestException extends MetadataApiException {

    public TokenRequestException(String message) {
        super(message);
    }

    public TokenRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
