package com.catalogsync.worldcat.auth;

/**
 * OAuth2 token endpoint operations used by {@link TokenLifecycleManager}.
 */
public interface OAuthTokenClient {

    /**
     * Client-credentials exchange. Returns a new access token and, when the refresh_token scope
     * is requested, a new refresh token.
     *
     * @throws TokenRequestException if the endpoint fails or returns an unusable body
     */
    TokenGrant fetchToken();

    /**
     * Exchanges a refresh token for a new access token. The grant may or may not carry a new
     * refresh token, depending on the server.
     *
     * @throws TokenRequestException if the endpoint fails or returns an unusable body
     */
    TokenGrant refreshToken(String refreshToken);
}
