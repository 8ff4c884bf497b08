package com.catalogsync.worldcat.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JsonFileCredentialStoreTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void load_missingFile_empty() {
        JsonFileCredentialStore store = new JsonFileCredentialStore(tempDir.resolve("creds.json"), objectMapper);

        assertThat(store.load()).isEmpty();
    }

    @Test
    void save_persistsAcrossInstancesAndMerges() {
        Path file = tempDir.resolve("sub/creds.json");
        JsonFileCredentialStore first = new JsonFileCredentialStore(file, objectMapper);
        first.save(Map.of(CredentialState.ACCESS_TOKEN, "a1", CredentialState.REFRESH_TOKEN, "r1"));
        first.save(Map.of(CredentialState.ACCESS_TOKEN, "a2"));

        JsonFileCredentialStore reopened = new JsonFileCredentialStore(file, objectMapper);

        assertThat(reopened.load())
                .containsEntry(CredentialState.ACCESS_TOKEN, "a2")
                .containsEntry(CredentialState.REFRESH_TOKEN, "r1")
                .hasSize(2);
    }
}
