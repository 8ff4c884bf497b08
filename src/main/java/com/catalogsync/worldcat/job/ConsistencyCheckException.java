package com.catalogsync.worldcat.job;

/**
 * The outcome counters do not add up to the number of rows read. Indicates a bookkeeping bug.
 */
public class ConsistencyCheckException extends IllegalStateException {

    public ConsistencyCheckException(String message) {
        super(message);
    }
}
