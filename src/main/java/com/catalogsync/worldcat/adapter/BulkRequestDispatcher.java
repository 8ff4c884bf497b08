package com.catalogsync.worldcat.adapter;

import com.catalogsync.domain.RecordOperation;
import com.catalogsync.worldcat.auth.TokenLifecycleManager;
import com.catalogsync.worldcat.buffer.IdentifierBuffer;
import com.catalogsync.worldcat.config.WorldCatProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Map;

/**
 * Turns the buffer contents into one WorldCat request and sends it with a valid access token.
 * <p>
 * Wire shapes:
 * <ul>
 *   <li>get current number: {@code GET {base}/bib/checkcontrolnumbers?oclcNumbers=..[&transactionID=..]}</li>
 *   <li>set holding: {@code POST {base}/ih/datalist?oclcNumbers=..[&transactionID=..]}</li>
 *   <li>unset holding: {@code DELETE {base}/ih/datalist?oclcNumbers=..&cascade=0|1[&transactionID=..]}</li>
 *   <li>search: {@code GET {searchBase}/brief-bibs?q=..&limit=2[&heldBySymbol=..]}</li>
 * </ul>
 * The buffer's request counter is incremented once the call returns, before the status is checked.
 */
@Slf4j
public class BulkRequestDispatcher {

    public static final String PARAM_CASCADE = "cascade";
    public static final String PARAM_QUERY = "q";
    public static final String PARAM_LIMIT = "limit";
    public static final String PARAM_HELD_BY_SYMBOL = "heldBySymbol";

    private final MetadataApiClient apiClient;
    private final TokenLifecycleManager tokenManager;
    private final TransactionIdBuilder transactionIdBuilder;
    private final WorldCatProperties properties;
    private final RateLimiter rateLimiter;

    public BulkRequestDispatcher(MetadataApiClient apiClient,
                                 TokenLifecycleManager tokenManager,
                                 TransactionIdBuilder transactionIdBuilder,
                                 WorldCatProperties properties,
                                 RateLimiter rateLimiter) {
        this.apiClient = apiClient;
        this.tokenManager = tokenManager;
        this.transactionIdBuilder = transactionIdBuilder;
        this.properties = properties;
        this.rateLimiter = rateLimiter;
    }

    /**
     * Sends the request for the buffered identifiers.
     *
     * @param extraParams {@code cascade} for unset holding; {@code q}, {@code limit} and optionally
     *                    {@code heldBySymbol} for search
     * @return the 2xx response
     * @throws HttpStatusException on any other status
     */
    public ApiResponse dispatch(RecordOperation operation, IdentifierBuffer buffer, Map<String, String> extraParams) {
        HttpMethod method = methodFor(operation);
        URI uri = buildUri(operation, buffer, extraParams);
        log.debug("{} request: {} {}", operation.getApiName(), method, uri);

        ApiResponse response = tokenManager.executeWithAuth(token -> {
            acquirePermission(uri);
            return apiClient.execute(method, uri, token);
        });
        buffer.recordApiRequest();

        log.debug("{} response: HTTP {} for {}", operation.getApiName(), response.statusCode(), uri);
        if (!response.isSuccessful()) {
            log.warn("{} returned HTTP {} for {}", operation.getApiName(), response.statusCode(), uri);
            throw new HttpStatusException(response.statusCode(), response.body());
        }
        return response;
    }

    static HttpMethod methodFor(RecordOperation operation) {
        return switch (operation) {
            case GET_CURRENT_NUMBER, SEARCH -> HttpMethod.GET;
            case SET_HOLDING -> HttpMethod.POST;
            case UNSET_HOLDING -> HttpMethod.DELETE;
        };
    }

    URI buildUri(RecordOperation operation, IdentifierBuffer buffer, Map<String, String> extraParams) {
        if (operation == RecordOperation.SEARCH) {
            return buildSearchUri(extraParams);
        }
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(properties.getMetadataApiUrl())
                .path(operation == RecordOperation.GET_CURRENT_NUMBER ? "/bib/checkcontrolnumbers" : "/ih/datalist")
                .queryParam("oclcNumbers", String.join(",", buffer.identifiers()));
        if (operation == RecordOperation.UNSET_HOLDING) {
            builder.queryParam(PARAM_CASCADE, required(extraParams, PARAM_CASCADE));
        }
        transactionIdBuilder.build().ifPresent(id -> builder.queryParam("transactionID", id));
        return builder.build().encode().toUri();
    }

    private URI buildSearchUri(Map<String, String> extraParams) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(properties.getSearchApiUrl())
                .path("/brief-bibs")
                .queryParam(PARAM_QUERY, required(extraParams, PARAM_QUERY))
                .queryParam(PARAM_LIMIT, extraParams.getOrDefault(PARAM_LIMIT, "2"));
        String heldBy = extraParams.get(PARAM_HELD_BY_SYMBOL);
        if (heldBy != null && !heldBy.isBlank()) {
            builder.queryParam(PARAM_HELD_BY_SYMBOL, heldBy);
        }
        return builder.build().encode().toUri();
    }

    private void acquirePermission(URI uri) {
        try {
            RateLimiter.waitForPermission(rateLimiter);
        } catch (RequestNotPermitted e) {
            throw new ConnectionFailureException("Local rate limit wait exceeded before calling " + uri, e);
        }
    }

    private static String required(Map<String, String> params, String name) {
        String value = params.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Missing request parameter '" + name + "'");
        }
        return value;
    }
}
