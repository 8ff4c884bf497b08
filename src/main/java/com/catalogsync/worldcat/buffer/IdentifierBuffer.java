package com.catalogsync.worldcat.buffer;

import java.util.List;

/**
 * Pending record identifiers waiting to be sent as one bulk request.
 * <p>
 * Variants: {@link DictBuffer} (OCLC number to MMS ID), {@link SetBuffer} (OCLC numbers only)
 * and {@link SingleRecordBuffer} (one search record). Capacity is not enforced here: the driver
 * checks {@link #size()} against the configured batch size and decides when to flush.
 * Contents are only ever cleared as a whole.
 */
public interface IdentifierBuffer {

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    boolean contains(String identifier);

    /**
     * Buffered identifiers in insertion order (OCLC numbers for holdings and current-number
     * lookups, the MMS ID for a search record).
     */
    List<String> identifiers();

    void clear();

    /** WorldCat API requests made through this buffer since it was created. */
    int getNumApiRequestsMade();

    void recordApiRequest();
}
