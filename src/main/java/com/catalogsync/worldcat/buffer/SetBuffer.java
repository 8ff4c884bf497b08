package com.catalogsync.worldcat.buffer;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * OCLC numbers whose WorldCat holding is to be set or unset.
 */
@Slf4j
public class SetBuffer implements IdentifierBuffer {

    private final Set<String> oclcNumbers = new LinkedHashSet<>();
    private int numApiRequestsMade;

    public void add(String oclcNumber) {
        if (!oclcNumbers.add(oclcNumber)) {
            throw new DuplicateIdentifierException("OCLC number " + oclcNumber + " already exists in records buffer");
        }
        log.debug("Added {} to records buffer.", oclcNumber);
    }

    @Override
    public int size() {
        return oclcNumbers.size();
    }

    @Override
    public boolean contains(String identifier) {
        return oclcNumbers.contains(identifier);
    }

    @Override
    public List<String> identifiers() {
        return List.copyOf(oclcNumbers);
    }

    @Override
    public void clear() {
        oclcNumbers.clear();
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
        return "Records buffer contents (OCLC Numbers): " + oclcNumbers;
    }
}
