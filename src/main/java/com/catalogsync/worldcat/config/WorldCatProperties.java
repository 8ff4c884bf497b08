package com.catalogsync.worldcat.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * WorldCat Metadata API endpoints, credentials and batching limits. Documented in application.yml
 * under catalogsync.worldcat.
 */
@ConfigurationProperties(prefix = "catalogsync.worldcat")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class WorldCatProperties {

    /** Base URL for check-control-numbers and institution holdings requests. */
    @NotBlank
    private String metadataApiUrl = "https://worldcat.org";

    /** Base URL for the brief-bibs search. */
    @NotBlank
    private String searchApiUrl = "https://americas.metadata.api.oclc.org/worldcat/search/v1";

    /** OCLC authorization server token endpoint. */
    @NotBlank
    private String tokenUrl = "https://oauth.oclc.org/token";

    /** WSKey client ID. */
    private String apiKey;

    /** WSKey secret. */
    private String apiSecret;

    /** Scope requested on client-credentials exchange; includes refresh_token to obtain a refresh token. */
    private String scope = "WorldCatMetadataAPI refresh_token";

    /** Server-enforced maximum number of OCLC numbers per bulk request. */
    @Min(1)
    private int maxRecordsPerRequest = 50;

    /** OCLC institution symbol; used in transaction IDs and as the held-by search filter. */
    private String institutionSymbol;

    /** WorldCat principal ID appended to transaction IDs. */
    private String principalId;

    /** Whether to send a transactionID parameter with check/holding requests. */
    private boolean includeTransactionId;

    /** Timeout for every outbound call (bulk requests and token requests). */
    @Min(1)
    private int requestTimeoutSeconds = 30;

    /** A refresh token with this many seconds or less remaining is not used; credentials are fetched anew. */
    @Min(0)
    private int refreshTokenSafetyMarginSeconds = 25;

    /** Local throttle for outbound API requests. */
    @Min(1)
    private int maxRequestsPerSecond = 10;

    /** JSON file where access and refresh tokens are persisted between runs. */
    @NotBlank
    private String credentialsFile = "worldcat-credentials.json";
}
