package com.catalogsync.worldcat.adapter;

import com.catalogsync.worldcat.auth.AuthExpiredException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientMetadataApiClientTest {

    private static final URI URL = URI.create("https://worldcat.test/bib/checkcontrolnumbers?oclcNumbers=1");

    @Test
    void execute_nonAuthError_returnsStatusAndBody() {
        WebClientMetadataApiClient client = new WebClientMetadataApiClient(
                respondingWith(HttpStatus.BAD_REQUEST, "{\"detail\":\"bad\"}"), Duration.ofSeconds(5));

        ApiResponse response = client.execute(HttpMethod.GET, URL, "tok");

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(response.body()).isEqualTo("{\"detail\":\"bad\"}");
        assertThat(response.isSuccessful()).isFalse();
    }

    @Test
    void execute_unauthorized_throwsAuthExpired() {
        WebClientMetadataApiClient client = new WebClientMetadataApiClient(
                respondingWith(HttpStatus.UNAUTHORIZED, "{}"), Duration.ofSeconds(5));

        assertThatThrownBy(() -> client.execute(HttpMethod.GET, URL, "tok")).isInstanceOf(AuthExpiredException.class);
    }

    @Test
    void execute_noResponseWithinTimeout_throwsConnectionFailure() {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> Mono.never());
        WebClientMetadataApiClient client = new WebClientMetadataApiClient(builder, Duration.ofMillis(100));

        assertThatThrownBy(() -> client.execute(HttpMethod.GET, URL, "tok"))
                .isInstanceOf(ConnectionFailureException.class)
                .hasMessageContaining("No response");
    }

    @Test
    void execute_connectionRefused_throwsConnectionFailure() {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> Mono.error(
                new WebClientRequestException(new ConnectException("Connection refused"), HttpMethod.GET, URL, new HttpHeaders())));
        WebClientMetadataApiClient client = new WebClientMetadataApiClient(builder, Duration.ofSeconds(5));

        assertThatThrownBy(() -> client.execute(HttpMethod.GET, URL, "tok"))
                .isInstanceOf(ConnectionFailureException.class)
                .hasCauseInstanceOf(WebClientRequestException.class);
    }

    private static WebClient.Builder respondingWith(HttpStatus status, String body) {
        return WebClient.builder().exchangeFunction(request -> Mono.just(ClientResponse.create(status)
                .header("Content-Type", "application/json")
                .body(body)
                .build()));
    }
}
