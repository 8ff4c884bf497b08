package com.catalogsync.worldcat.search;

/**
 * Result of searching WorldCat for one record.
 *
 * @param oclcNumber   OCLC number of the single match, or null when there was none or several
 * @param numHeld      match count with the held-by filter, or null when that search was not made
 * @param numTotal     match count without the filter, or null when that search was not made
 * @param requestsMade API requests the search needed (1 or 2)
 */
public record SearchOutcome(String oclcNumber, Integer numHeld, Integer numTotal, int requestsMade) {

    public boolean isFound() {
        return oclcNumber != null;
    }
}
