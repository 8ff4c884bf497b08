package com.catalogsync.domain;

/**
 * Category a processed input row ends up in. Each operation uses its own subset plus
 * {@link #ERROR} and {@link #NOT_PROCESSED}.
 */
public enum OutcomeCategory {
    CURRENT("records with current OCLC number"),
    OLD("records with old OCLC number"),
    UPDATED("records updated"),
    NO_UPDATE_NEEDED("records with no update needed"),
    OCLC_NUMBER_FOUND("records with OCLC number"),
    ZERO_OR_MULTIPLE_MATCHES("records with zero or multiple WorldCat matches"),
    ERROR("records with errors"),
    NOT_PROCESSED("records not processed");

    private final String label;

    OutcomeCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
