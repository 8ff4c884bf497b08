package com.catalogsync.worldcat.adapter;

/**
 * Raw HTTP response from a WorldCat request.
 */
public record ApiResponse(int statusCode, String body) {

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
