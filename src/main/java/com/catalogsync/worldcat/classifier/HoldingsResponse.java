package com.catalogsync.worldcat.classifier;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Body of POST and DELETE /ih/datalist.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HoldingsResponse(List<Entry> entry) {

    /**
     * @param httpStatusCode per-record status as text, e.g. "HTTP 200 OK" or "HTTP 409 Conflict"
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(String requestedOclcNumber,
                        String currentOclcNumber,
                        String institution,
                        String httpStatusCode,
                        String errorDetail) {
    }
}
