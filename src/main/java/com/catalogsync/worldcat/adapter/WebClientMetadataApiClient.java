package com.catalogsync.worldcat.adapter;

import com.catalogsync.worldcat.auth.AuthExpiredException;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Metadata API client using WebClient in blocking mode, one exchange per call with a fixed timeout.
 */
public class WebClientMetadataApiClient implements MetadataApiClient {

    private static final int UNAUTHORIZED = 401;

    private final WebClient webClient;
    private final Duration timeout;

    public WebClientMetadataApiClient(WebClient.Builder builder, Duration timeout) {
        this.webClient = builder.build();
        this.timeout = timeout;
    }

    @Override
    public ApiResponse execute(HttpMethod method, URI uri, String accessToken) {
        ApiResponse response = webClient.method(method)
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON)
                .headers(h -> h.setBearerAuth(accessToken == null ? "" : accessToken))
                .exchangeToMono(r -> r.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new ApiResponse(r.statusCode().value(), body)))
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> new ConnectionFailureException(
                        "No response from " + uri + " within " + timeout.toSeconds() + "s", e))
                .onErrorMap(WebClientRequestException.class, e -> new ConnectionFailureException(
                        "Request to " + uri + " failed: " + e.getMessage(), e))
                .block();
        if (response == null) {
            throw new ConnectionFailureException("Empty response from " + uri, null);
        }
        if (response.statusCode() == UNAUTHORIZED) {
            throw new AuthExpiredException("HTTP 401 from " + uri + ": " + response.body());
        }
        return response;
    }
}
