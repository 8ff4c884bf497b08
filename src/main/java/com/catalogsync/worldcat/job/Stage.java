package com.catalogsync.worldcat.job;

/**
 * Processing stage a failure happened in; named in batch-level error rows.
 */
public enum Stage {
    VALIDATION("Input validation"),
    REQUEST("API request"),
    CLASSIFICATION("Response classification"),
    SEARCH("WorldCat search");

    private final String label;

    Stage(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
