package com.catalogsync.worldcat.config;

import com.catalogsync.worldcat.adapter.BulkRequestDispatcher;
import com.catalogsync.worldcat.adapter.MetadataApiClient;
import com.catalogsync.worldcat.adapter.TransactionIdBuilder;
import com.catalogsync.worldcat.adapter.WebClientMetadataApiClient;
import com.catalogsync.worldcat.auth.CredentialStore;
import com.catalogsync.worldcat.auth.JsonFileCredentialStore;
import com.catalogsync.worldcat.auth.OAuthTokenClient;
import com.catalogsync.worldcat.auth.TokenLifecycleManager;
import com.catalogsync.worldcat.auth.WebClientOAuthTokenClient;
import com.catalogsync.worldcat.classifier.ResponseBodyParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Wires the WorldCat clients: token lifecycle, HTTP client, local rate limiter and dispatcher.
 */
@Configuration
@EnableConfigurationProperties(WorldCatProperties.class)
public class WorldCatClientConfig {

    @Bean
    public CredentialStore credentialStore(WorldCatProperties properties, ObjectMapper objectMapper) {
        return new JsonFileCredentialStore(Path.of(properties.getCredentialsFile()), objectMapper);
    }

    @Bean
    public OAuthTokenClient oauthTokenClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                                             WorldCatProperties properties) {
        return new WebClientOAuthTokenClient(webClientBuilder, objectMapper, properties);
    }

    @Bean
    public TokenLifecycleManager tokenLifecycleManager(OAuthTokenClient oauthTokenClient, CredentialStore credentialStore,
                                                       WorldCatProperties properties) {
        return new TokenLifecycleManager(oauthTokenClient, credentialStore, properties);
    }

    @Bean
    public MetadataApiClient metadataApiClient(WebClient.Builder webClientBuilder, WorldCatProperties properties) {
        return new WebClientMetadataApiClient(webClientBuilder, Duration.ofSeconds(properties.getRequestTimeoutSeconds()));
    }

    /** Waits up to the request timeout for a permit before failing the request. */
    @Bean(name = "worldcatRateLimiter")
    public RateLimiter worldcatRateLimiter(WorldCatProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .build();
        return RateLimiter.of("worldcat-metadata-api", config);
    }

    @Bean
    public BulkRequestDispatcher bulkRequestDispatcher(MetadataApiClient metadataApiClient,
                                                       TokenLifecycleManager tokenLifecycleManager,
                                                       WorldCatProperties properties,
                                                       @Qualifier("worldcatRateLimiter") RateLimiter worldcatRateLimiter) {
        return new BulkRequestDispatcher(metadataApiClient, tokenLifecycleManager, new TransactionIdBuilder(properties),
                properties, worldcatRateLimiter);
    }

    @Bean
    public ResponseBodyParser responseBodyParser(ObjectMapper objectMapper) {
        return new ResponseBodyParser(objectMapper);
    }
}
