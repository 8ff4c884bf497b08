package com.catalogsync.worldcat.auth;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Credential store that lives only as long as the process.
 */
public class InMemoryCredentialStore implements CredentialStore {

    private final Map<String, String> values = new LinkedHashMap<>();

    public InMemoryCredentialStore() {
    }

    public InMemoryCredentialStore(Map<String, String> initial) {
        values.putAll(initial);
    }

    @Override
    public synchronized Map<String, String> load() {
        return Map.copyOf(values);
    }

    @Override
    public synchronized void save(Map<String, String> updates) {
        values.putAll(updates);
    }
}
