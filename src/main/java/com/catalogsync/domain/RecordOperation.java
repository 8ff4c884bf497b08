package com.catalogsync.domain;

import java.util.List;

/**
 * Bulk operations issued against the WorldCat Metadata API.
 */
public enum RecordOperation {
    GET_CURRENT_NUMBER("Get Current OCLC Number API",
            List.of(OutcomeCategory.CURRENT, OutcomeCategory.OLD, OutcomeCategory.ERROR)),
    SET_HOLDING("Set Holding API",
            List.of(OutcomeCategory.UPDATED, OutcomeCategory.NO_UPDATE_NEEDED, OutcomeCategory.ERROR)),
    UNSET_HOLDING("Unset Holding API",
            List.of(OutcomeCategory.UPDATED, OutcomeCategory.NO_UPDATE_NEEDED, OutcomeCategory.ERROR)),
    SEARCH("Search Brief Bibliographic Resources API",
            List.of(OutcomeCategory.OCLC_NUMBER_FOUND, OutcomeCategory.ZERO_OR_MULTIPLE_MATCHES, OutcomeCategory.ERROR));

    private final String apiName;
    private final List<OutcomeCategory> categories;

    RecordOperation(String apiName, List<OutcomeCategory> categories) {
        this.apiName = apiName;
        this.categories = categories;
    }

    public String getApiName() {
        return apiName;
    }

    /** Categories an input row can be classified into, excluding {@link OutcomeCategory#NOT_PROCESSED}. */
    public List<OutcomeCategory> getCategories() {
        return categories;
    }
}
