package com.catalogsync.worldcat.adapter;

import com.catalogsync.worldcat.config.WorldCatProperties;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds the transactionID query parameter: {symbol}_{timestamp}_{principalId}, empty parts omitted.
 */
public class TransactionIdBuilder {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private final WorldCatProperties properties;

    public TransactionIdBuilder(WorldCatProperties properties) {
        this.properties = properties;
    }

    /** Transaction ID for a request sent now, or empty when transaction IDs are disabled or nothing identifies the caller. */
    public Optional<String> build() {
        return build(Instant.now());
    }

    Optional<String> build(Instant now) {
        String symbol = strip(properties.getInstitutionSymbol());
        String principal = strip(properties.getPrincipalId());
        if (!properties.isIncludeTransactionId() || (symbol.isEmpty() && principal.isEmpty())) {
            return Optional.empty();
        }
        List<String> parts = new ArrayList<>(3);
        if (!symbol.isEmpty()) {
            parts.add(symbol);
        }
        parts.add(TIMESTAMP.format(now));
        if (!principal.isEmpty()) {
            parts.add(principal);
        }
        return Optional.of(String.join("_", parts));
    }

    private static String strip(String value) {
        return value == null ? "" : value.strip();
    }
}
