package com.catalogsync.worldcat.buffer;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Holds the one record currently being searched for. Never holds more than one record.
 */
@Slf4j
public class SingleRecordBuffer implements IdentifierBuffer {

    private SearchRecord record;
    private int numApiRequestsMade;

    public void add(SearchRecord searchRecord) {
        if (record != null) {
            throw new DuplicateIdentifierException("Cannot add to a non-empty search buffer. Buffer currently contains "
                    + size() + " record(s).");
        }
        record = searchRecord;
        log.debug("Added {} to records buffer.", searchRecord);
    }

    public Optional<SearchRecord> current() {
        return Optional.ofNullable(record);
    }

    @Override
    public int size() {
        return record == null ? 0 : 1;
    }

    @Override
    public boolean contains(String identifier) {
        return record != null && record.mmsId().equals(identifier);
    }

    @Override
    public List<String> identifiers() {
        return record == null ? List.of() : List.of(record.mmsId());
    }

    @Override
    public void clear() {
        record = null;
        log.debug("Cleared records buffer.");
    }

    @Override
    public int getNumApiRequestsMade() {
        return numApiRequestsMade;
    }

    @Override
    public void recordApiRequest() {
        numApiRequestsMade++;
    }

    @Override
    public String toString() {
        return "Records buffer contents: " + (record == null ? "[]" : "[" + record + "]");
    }
}
