package com.catalogsync.file;

/**
 * Lazy, finite, single-pass sequence of input rows.
 */
public interface RowSource extends Iterable<InputRow> {
}
