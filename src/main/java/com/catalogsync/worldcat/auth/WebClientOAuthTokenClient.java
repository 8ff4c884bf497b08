package com.catalogsync.worldcat.auth;

import com.catalogsync.worldcat.config.WorldCatProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.concurrent.TimeoutException;

/**
 * OCLC token endpoint client using WebClient. HTTP Basic auth with the WSKey and secret, form body.
 */
@Slf4j
public class WebClientOAuthTokenClient implements OAuthTokenClient {

    /** Format of expires_at and refresh_token_expires_at in token responses, e.g. 2024-01-01 12:00:00Z. */
    static final DateTimeFormatter EXPIRY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss'Z'");

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final WorldCatProperties properties;

    public WebClientOAuthTokenClient(WebClient.Builder builder, ObjectMapper objectMapper, WorldCatProperties properties) {
        this.webClient = builder.build();
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public TokenGrant fetchToken() {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");
        if (properties.getScope() != null && !properties.getScope().isBlank()) {
            form.add("scope", properties.getScope());
        }
        log.debug("Requesting new access token via client credentials");
        return parseGrant(post(form), Instant.now());
    }

    @Override
    public TokenGrant refreshToken(String refreshToken) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "refresh_token");
        form.add("refresh_token", refreshToken);
        log.debug("Requesting new access token via refresh token");
        return parseGrant(post(form), Instant.now());
    }

    private String post(MultiValueMap<String, String> form) {
        if (properties.getApiKey() == null || properties.getApiKey().isBlank()) {
            throw new TokenRequestException("WorldCat API key is not configured");
        }
        return webClient.post()
                .uri(properties.getTokenUrl())
                .accept(MediaType.APPLICATION_JSON)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .headers(h -> h.setBasicAuth(properties.getApiKey(), nullToEmpty(properties.getApiSecret())))
                .body(BodyInserters.fromFormData(form))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .onErrorMap(WebClientResponseException.class, e -> new TokenRequestException(
                        "Token request failed with HTTP " + e.getStatusCode().value() + ": " + e.getResponseBodyAsString(), e))
                .onErrorMap(TimeoutException.class, e -> new TokenRequestException(
                        "Token request timed out after " + properties.getRequestTimeoutSeconds() + "s", e))
                .onErrorMap(WebClientRequestException.class, e -> new TokenRequestException(
                        "Token request could not reach " + properties.getTokenUrl() + ": " + e.getMessage(), e))
                .blockOptional()
                .orElseThrow(() -> new TokenRequestException("Token endpoint returned an empty body"));
    }

    TokenGrant parseGrant(String body, Instant now) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TokenRequestException("Token endpoint returned invalid JSON", e);
        }
        String accessToken = root.path("access_token").asText(null);
        if (accessToken == null || accessToken.isBlank()) {
            throw new TokenRequestException("Token response has no access_token");
        }
        String tokenType = root.path("token_type").asText(null);
        Instant accessExpiry = expiry(root, "expires_in", "expires_at", now);
        String refreshToken = root.path("refresh_token").asText(null);
        Instant refreshExpiry = refreshToken == null
                ? null
                : expiry(root, "refresh_token_expires_in", "refresh_token_expires_at", now);
        return new TokenGrant(accessToken, tokenType, accessExpiry, refreshToken, refreshExpiry);
    }

    private static Instant expiry(JsonNode root, String secondsField, String instantField, Instant now) {
        JsonNode seconds = root.path(secondsField);
        if (seconds.canConvertToLong()) {
            return now.plusSeconds(seconds.asLong());
        }
        JsonNode at = root.path(instantField);
        if (at.isTextual()) {
            try {
                return LocalDateTime.parse(at.asText().strip(), EXPIRY_FORMAT).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                throw new TokenRequestException("Unparseable " + instantField + " in token response: " + at.asText(), e);
            }
        }
        return null;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
