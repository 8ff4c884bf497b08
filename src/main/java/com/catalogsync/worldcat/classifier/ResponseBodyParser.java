package com.catalogsync.worldcat.classifier;

import com.catalogsync.worldcat.adapter.ApiResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Parses WorldCat response bodies into typed records before any outcome is recorded.
 */
@RequiredArgsConstructor
@Slf4j
public class ResponseBodyParser {

    private final ObjectMapper objectMapper;

    public <T> T parse(ApiResponse response, Class<T> type, String apiName) {
        String body = response.body();
        if (body == null || body.isBlank()) {
            throw new MalformedResponseException("Problem with " + apiName + " response: empty body");
        }
        try {
            T parsed = objectMapper.readValue(body, type);
            if (parsed == null) {
                throw new MalformedResponseException("Problem with " + apiName + " response: null body");
            }
            return parsed;
        } catch (JsonProcessingException e) {
            log.error("Problem with {} response: Error decoding JSON. API Response:\n{}", apiName, body);
            throw new MalformedResponseException("Problem with " + apiName + " response: Error decoding JSON", e);
        }
    }
}
