package com.catalogsync.worldcat.adapter;

import com.catalogsync.worldcat.MetadataApiException;
import lombok.Getter;

/**
 * A bulk request came back with a non-2xx status. Fatal for the run.
 */
@Getter
public class HttpStatusException extends MetadataApiException {

    private final int statusCode;
    private final String responseBody;

    public HttpStatusException(int statusCode, String responseBody) {
        super("HTTP " + statusCode + ": " + responseBody);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }
}
