package com.catalogsync.worldcat.search;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Body of GET /brief-bibs. Only the match count and the OCLC numbers are read.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BriefBibsResponse(Integer numberOfRecords, List<BriefRecord> briefRecords) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BriefRecord(String oclcNumber) {
    }
}
