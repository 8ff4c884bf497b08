package com.catalogsync.worldcat.auth;

import java.util.Map;

/**
 * Key/value persistence for credential fields so later runs can reuse tokens.
 */
public interface CredentialStore {

    /** All stored fields; empty when nothing has been stored yet. */
    Map<String, String> load();

    /** Adds or replaces the given fields and persists them immediately. */
    void save(Map<String, String> updates);
}
