package com.catalogsync.worldcat.auth;

import com.catalogsync.worldcat.config.WorldCatProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientOAuthTokenClientTest {

    private WorldCatProperties properties;
    private final AtomicReference<ClientRequest> captured = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        properties = new WorldCatProperties();
        properties.setTokenUrl("https://oauth.test/token");
        properties.setApiKey("key");
        properties.setApiSecret("secret");
    }

    @Test
    void fetchToken_postsWithBasicAuthAndParsesGrant() {
        WebClientOAuthTokenClient client = client(HttpStatus.OK, """
                {"access_token":"tk_abc","token_type":"bearer","expires_in":1199,
                 "refresh_token":"rt_xyz","refresh_token_expires_at":"2030-01-01 12:00:00Z"}
                """);
        Instant before = Instant.now();

        TokenGrant grant = client.fetchToken();

        ClientRequest request = captured.get();
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url().toString()).isEqualTo("https://oauth.test/token");
        String expectedAuth = "Basic " + Base64.getEncoder().encodeToString("key:secret".getBytes(StandardCharsets.UTF_8));
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo(expectedAuth);

        assertThat(grant.accessToken()).isEqualTo("tk_abc");
        assertThat(grant.tokenType()).isEqualTo("bearer");
        assertThat(grant.accessTokenExpiresAt()).isBetween(before.plusSeconds(1199), Instant.now().plusSeconds(1199));
        assertThat(grant.refreshToken()).isEqualTo("rt_xyz");
        assertThat(grant.refreshTokenExpiresAt()).isEqualTo(Instant.parse("2030-01-01T12:00:00Z"));
    }

    @Test
    void parseGrant_expiresAtOnly_usesAbsoluteInstant() {
        WebClientOAuthTokenClient client = client(HttpStatus.OK, "{}");

        TokenGrant grant = client.parseGrant("{\"access_token\":\"a\",\"expires_at\":\"2029-05-06 07:08:09Z\"}", Instant.now());

        assertThat(grant.accessTokenExpiresAt()).isEqualTo(Instant.parse("2029-05-06T07:08:09Z"));
        assertThat(grant.hasRefreshToken()).isFalse();
        assertThat(grant.refreshTokenExpiresAt()).isNull();
    }

    @Test
    void refreshToken_endpointRejects_throwsTokenRequestException() {
        WebClientOAuthTokenClient client = client(HttpStatus.UNAUTHORIZED, "{\"message\":\"invalid refresh token\"}");

        assertThatThrownBy(() -> client.refreshToken("rt_old"))
                .isInstanceOf(TokenRequestException.class)
                .hasMessageContaining("HTTP 401");
    }

    @Test
    void parseGrant_noAccessToken_throws() {
        WebClientOAuthTokenClient client = client(HttpStatus.OK, "{}");

        assertThatThrownBy(() -> client.parseGrant("{\"token_type\":\"bearer\"}", Instant.now()))
                .isInstanceOf(TokenRequestException.class);
    }

    @Test
    void fetchToken_missingApiKey_throwsWithoutCalling() {
        properties.setApiKey(" ");
        WebClientOAuthTokenClient client = client(HttpStatus.OK, "{}");

        assertThatThrownBy(client::fetchToken).isInstanceOf(TokenRequestException.class);
        assertThat(captured.get()).isNull();
    }

    private WebClientOAuthTokenClient client(HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            captured.set(request);
            return Mono.just(ClientResponse.create(status)
                    .header("Content-Type", "application/json")
                    .body(body)
                    .build());
        });
        return new WebClientOAuthTokenClient(builder, new ObjectMapper(), properties);
    }
}
