package com.catalogsync.worldcat.classifier;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Body of GET /bib/checkcontrolnumbers.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ControlNumbersResponse(List<Entry> entry) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(String requestedOclcNumber,
                        String currentOclcNumber,
                        Boolean found,
                        Boolean merged) {
    }
}
