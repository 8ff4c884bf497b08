package com.catalogsync.worldcat.auth;

import java.time.Instant;

/**
 * Credentials issued by the token endpoint. Refresh token fields are null when the grant
 * did not include a refresh token.
 */
public record TokenGrant(String accessToken,
                         String tokenType,
                         Instant accessTokenExpiresAt,
                         String refreshToken,
                         Instant refreshTokenExpiresAt) {

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }
}
