package com.catalogsync.worldcat.job;

/**
 * Whether a failure affects one input row or every identifier in the current batch.
 */
public enum FailureScope {
    ROW_LEVEL,
    BATCH_LEVEL
}
