package com.catalogsync.worldcat.auth;

import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Current OAuth2 credentials. All instants are absolute UTC (epoch based).
 */
@Getter
@Setter
public class CredentialState {

    public static final String ACCESS_TOKEN = "accessToken";
    public static final String ACCESS_TOKEN_TYPE = "accessTokenType";
    public static final String ACCESS_TOKEN_EXPIRES_AT = "accessTokenExpiresAt";
    public static final String REFRESH_TOKEN = "refreshToken";
    public static final String REFRESH_TOKEN_EXPIRES_AT = "refreshTokenExpiresAt";

    private String accessToken;
    private String accessTokenType;
    private Instant accessTokenExpiresAt;
    private String refreshToken;
    private Instant refreshTokenExpiresAt;

    public static CredentialState fromStoredValues(Map<String, String> stored) {
        CredentialState state = new CredentialState();
        state.setAccessToken(blankToNull(stored.get(ACCESS_TOKEN)));
        state.setAccessTokenType(blankToNull(stored.get(ACCESS_TOKEN_TYPE)));
        state.setAccessTokenExpiresAt(parseInstant(stored.get(ACCESS_TOKEN_EXPIRES_AT)));
        state.setRefreshToken(blankToNull(stored.get(REFRESH_TOKEN)));
        state.setRefreshTokenExpiresAt(parseInstant(stored.get(REFRESH_TOKEN_EXPIRES_AT)));
        return state;
    }

    public boolean hasAccessToken() {
        return accessToken != null;
    }

    /** True when the stored access-token expiry has passed. Unknown expiry counts as not expired. */
    public boolean isAccessTokenExpired(Instant now) {
        return accessTokenExpiresAt != null && !now.isBefore(accessTokenExpiresAt);
    }

    /**
     * Remaining lifetime of the refresh token, or {@link Duration#ZERO} when there is no refresh
     * token or its expiry is unknown.
     */
    public Duration refreshTokenRemaining(Instant now) {
        if (refreshToken == null || refreshTokenExpiresAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(now, refreshTokenExpiresAt);
    }

    /**
     * Applies a grant and returns the fields that changed, in store form. Refresh token fields
     * are only touched when the grant carries a refresh token.
     */
    public Map<String, String> apply(TokenGrant grant) {
        Map<String, String> updates = new LinkedHashMap<>();
        accessToken = grant.accessToken();
        accessTokenType = grant.tokenType();
        accessTokenExpiresAt = grant.accessTokenExpiresAt();
        updates.put(ACCESS_TOKEN, accessToken);
        updates.put(ACCESS_TOKEN_TYPE, accessTokenType == null ? "" : accessTokenType);
        updates.put(ACCESS_TOKEN_EXPIRES_AT, accessTokenExpiresAt == null ? "" : accessTokenExpiresAt.toString());
        if (grant.hasRefreshToken()) {
            refreshToken = grant.refreshToken();
            refreshTokenExpiresAt = grant.refreshTokenExpiresAt();
            updates.put(REFRESH_TOKEN, refreshToken);
            updates.put(REFRESH_TOKEN_EXPIRES_AT, refreshTokenExpiresAt == null ? "" : refreshTokenExpiresAt.toString());
        }
        return updates;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static Instant parseInstant(String value) {
        return value == null || value.isBlank() ? null : Instant.parse(value.strip());
    }
}
