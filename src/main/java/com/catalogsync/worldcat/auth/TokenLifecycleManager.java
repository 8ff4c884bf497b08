package com.catalogsync.worldcat.auth;

import com.catalogsync.worldcat.config.WorldCatProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.function.Function;

/**
 * Owns the OAuth2 credentials for WorldCat requests and recovers from an expired access token
 * at most once per request.
 * <p>
 * Renewal prefers the refresh-token grant while the refresh token has more than the configured
 * safety margin left; otherwise a full client-credentials exchange is made. Every renewed field
 * is written to the {@link CredentialStore}.
 */
@Slf4j
public class TokenLifecycleManager {

    private final OAuthTokenClient tokenClient;
    private final CredentialStore credentialStore;
    private final Duration refreshSafetyMargin;
    private final CredentialState state;

    public TokenLifecycleManager(OAuthTokenClient tokenClient, CredentialStore credentialStore, WorldCatProperties properties) {
        this.tokenClient = tokenClient;
        this.credentialStore = credentialStore;
        this.refreshSafetyMargin = Duration.ofSeconds(properties.getRefreshTokenSafetyMarginSeconds());
        this.state = CredentialState.fromStoredValues(credentialStore.load());
    }

    public synchronized String currentAccessToken() {
        return state.getAccessToken();
    }

    /**
     * Runs a request with the current access token. When no valid token is held, credentials are
     * renewed first. When the request fails with {@link AuthExpiredException} and nothing has been
     * renewed yet for this request, credentials are renewed and the request is issued once more.
     * Any other failure, or a second auth failure, propagates unchanged.
     */
    public <T> T executeWithAuth(Function<String, T> request) {
        boolean renewed = false;
        String token;
        synchronized (this) {
            if (!state.hasAccessToken() || state.isAccessTokenExpired(Instant.now())) {
                log.info("No valid access token held; requesting credentials before the first call");
                renew();
                renewed = true;
            }
            token = state.getAccessToken();
        }
        try {
            return request.apply(token);
        } catch (AuthExpiredException e) {
            if (renewed) {
                throw e;
            }
            log.info("Access token rejected ({}); renewing credentials and retrying once", e.getMessage());
            String renewedToken = renew();
            return request.apply(renewedToken);
        }
    }

    /**
     * Renews the credentials and persists them. Returns the new access token.
     */
    public synchronized String renew() {
        Instant now = Instant.now();
        Duration refreshRemaining = state.refreshTokenRemaining(now);
        TokenGrant grant;
        if (state.getRefreshToken() != null && refreshRemaining.compareTo(refreshSafetyMargin) > 0) {
            log.debug("Refresh token valid for another {}s; using refresh-token grant", refreshRemaining.toSeconds());
            grant = tokenClient.refreshToken(state.getRefreshToken());
        } else {
            log.debug("Refresh token missing or within {}s of expiry; using client-credentials grant",
                    refreshSafetyMargin.toSeconds());
            grant = tokenClient.fetchToken();
        }
        Map<String, String> updates = state.apply(grant);
        credentialStore.save(updates);
        log.info("Access token renewed; expires at {}", state.getAccessTokenExpiresAt());
        return state.getAccessToken();
    }
}
