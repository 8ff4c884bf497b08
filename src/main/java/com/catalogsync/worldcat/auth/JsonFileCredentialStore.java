package com.catalogsync.worldcat.auth;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Credential store backed by a flat JSON object on disk. The file is rewritten on every save.
 */
@Slf4j
public class JsonFileCredentialStore implements CredentialStore {

    private static final TypeReference<LinkedHashMap<String, String>> MAP_TYPE = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Map<String, String> values;

    public JsonFileCredentialStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
        this.values = read();
    }

    @Override
    public synchronized Map<String, String> load() {
        return Map.copyOf(values);
    }

    @Override
    public synchronized void save(Map<String, String> updates) {
        values.putAll(updates);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), values);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Persisted credential fields {} to {}", updates.keySet(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist credentials to " + file, e);
        }
    }

    private Map<String, String> read() {
        if (!Files.exists(file)) {
            log.info("No stored credentials at {}; a new access token will be requested", file);
            return new LinkedHashMap<>();
        }
        try {
            Map<String, String> stored = objectMapper.readValue(file.toFile(), MAP_TYPE);
            return stored == null ? new LinkedHashMap<>() : stored;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read stored credentials from " + file, e);
        }
    }
}
