package com.catalogsync.worldcat.buffer;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps each record's original OCLC number to its MMS ID. Used to find current OCLC numbers.
 */
@Slf4j
public class DictBuffer implements IdentifierBuffer {

    private final Map<String, String> oclcNumberToMmsId = new LinkedHashMap<>();
    private int numApiRequestsMade;

    public void add(String originalOclcNumber, String mmsId) {
        String existing = oclcNumberToMmsId.get(originalOclcNumber);
        if (existing != null) {
            throw new DuplicateIdentifierException("OCLC number " + originalOclcNumber
                    + " already exists in records buffer with MMS ID " + existing);
        }
        oclcNumberToMmsId.put(originalOclcNumber, mmsId);
        log.debug("Added {} to records buffer.", originalOclcNumber);
    }

    /** MMS ID buffered for the given original OCLC number. */
    public Optional<String> mmsIdFor(String originalOclcNumber) {
        return Optional.ofNullable(oclcNumberToMmsId.get(originalOclcNumber));
    }

    public Map<String, String> entries() {
        return Map.copyOf(oclcNumberToMmsId);
    }

    @Override
    public int size() {
        return oclcNumberToMmsId.size();
    }

    @Override
    public boolean contains(String identifier) {
        return oclcNumberToMmsId.containsKey(identifier);
    }

    @Override
    public List<String> identifiers() {
        return List.copyOf(oclcNumberToMmsId.keySet());
    }

    @Override
    public void clear() {
        oclcNumberToMmsId.clear();
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
        return "Records buffer contents ({OCLC Number: MMS ID}): " + oclcNumberToMmsId;
    }
}
