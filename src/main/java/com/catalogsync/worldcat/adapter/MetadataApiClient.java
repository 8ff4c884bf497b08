package com.catalogsync.worldcat.adapter;

import org.springframework.http.HttpMethod;

import java.net.URI;

/**
 * Single HTTP exchange with the WorldCat Metadata API. Used by {@link BulkRequestDispatcher}.
 */
public interface MetadataApiClient {

    /**
     * Sends one request and waits for the response.
     *
     * @throws com.catalogsync.worldcat.auth.AuthExpiredException on HTTP 401
     * @throws ConnectionFailureException                         on timeout or transport failure
     */
    ApiResponse execute(HttpMethod method, URI uri, String accessToken);
}
