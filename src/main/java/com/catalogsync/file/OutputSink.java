package com.catalogsync.file;

import java.util.List;

/**
 * Appendable destination for outcome rows.
 */
public interface OutputSink {

    /** True while nothing has been written to the destination (decides whether a header is due). */
    boolean isEmpty();

    /** Appends one row (ordered field values). */
    void append(List<String> row);
}
