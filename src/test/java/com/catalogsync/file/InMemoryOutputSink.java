package com.catalogsync.file;

import java.util.ArrayList;
import java.util.List;

/**
 * Output sink that keeps appended rows in memory for assertions.
 */
public class InMemoryOutputSink implements OutputSink {

    private final List<List<String>> rows = new ArrayList<>();

    @Override
    public boolean isEmpty() {
        return rows.isEmpty();
    }

    @Override
    public void append(List<String> row) {
        rows.add(List.copyOf(row));
    }

    /** Every appended row, header included. */
    public List<List<String>> rows() {
        return rows;
    }

    /** Appended rows after the header. */
    public List<List<String>> dataRows() {
        return rows.isEmpty() ? List.of() : rows.subList(1, rows.size());
    }
}
