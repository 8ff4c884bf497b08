package com.catalogsync.domain;

/**
 * Unset-holding behaviour when local holdings or local bibliographic records exist.
 */
public enum Cascade {
    /** Do not unset the holding if local records exist. */
    ABORT_IF_LOCAL_RECORDS(0),
    /** Unset the holding and delete local holdings and local bibliographic records. */
    FORCE_REMOVAL(1);

    private final int value;

    Cascade(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    public static Cascade fromValue(int value) {
        for (Cascade c : values()) {
            if (c.value == value) {
                return c;
            }
        }
        throw new IllegalArgumentException("Cascade must be 0 or 1, got " + value);
    }
}
