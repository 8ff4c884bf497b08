package com.catalogsync.worldcat.classifier;

import com.catalogsync.domain.OutcomeCategory;
import com.catalogsync.domain.RecordOperation;
import com.catalogsync.worldcat.adapter.ApiResponse;
import com.catalogsync.worldcat.buffer.SetBuffer;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Routes each institution-holdings entry to updated, no-update-needed or error. Also flags
 * requested OCLC numbers that WorldCat has since merged into a newer number.
 * <p>
 * Every entry must answer a buffered OCLC number, at most once per response.
 */
@Slf4j
public class HoldingClassifier {

    static final String STATUS_OK = "HTTP 200 OK";
    static final String STATUS_CONFLICT = "HTTP 409 Conflict";

    private final ResponseBodyParser parser;
    private final String apiName;

    public HoldingClassifier(ResponseBodyParser parser, RecordOperation operation) {
        if (operation != RecordOperation.SET_HOLDING && operation != RecordOperation.UNSET_HOLDING) {
            throw new IllegalArgumentException("Not a holdings operation: " + operation);
        }
        this.parser = parser;
        this.apiName = operation.getApiName();
    }

    public void classify(ApiResponse response, SetBuffer buffer, OutcomeRecorder recorder) {
        String errorPrefix = "Problem with " + apiName + " response";
        for (HoldingsResponse.Entry entry : parseEntries(response)) {
            String requested = entry.requestedOclcNumber();
            if (!buffer.contains(requested)) {
                throw new IllegalStateException("Response entry for OCLC number " + requested
                        + " has no matching buffered record. " + buffer);
            }
            if (recorder.isRecordedInBatch(requested)) {
                throw new IllegalStateException("Response contains more than one entry for OCLC number " + requested);
            }
            String newNumber = "";
            String warning = "";
            if (entry.currentOclcNumber() != null && !requested.equals(entry.currentOclcNumber())) {
                newNumber = entry.currentOclcNumber();
                String message = "OCLC number " + requested + " has been updated to " + newNumber
                        + ". Consider updating Alma record.";
                log.warn(message);
                warning = "Warning: " + message;
            }
            log.debug("OCLC number {}: {} ({})", requested, entry.httpStatusCode(), entry.errorDetail());

            if (STATUS_OK.equals(entry.httpStatusCode())) {
                recorder.record(OutcomeCategory.UPDATED, requested, List.of(requested, newNumber, warning));
            } else if (STATUS_CONFLICT.equals(entry.httpStatusCode())) {
                recorder.record(OutcomeCategory.NO_UPDATE_NEEDED, requested, List.of(requested, newNumber,
                        errorPrefix + ": " + entry.errorDetail() + ". " + warning));
            } else {
                log.error("{} for OCLC Number {}: {} ({})", errorPrefix, requested, entry.errorDetail(), entry.httpStatusCode());
                recorder.record(OutcomeCategory.ERROR, requested, List.of(requested, newNumber,
                        errorPrefix + ": " + entry.httpStatusCode() + ": " + entry.errorDetail() + ". " + warning));
            }
        }
    }

    private List<HoldingsResponse.Entry> parseEntries(ApiResponse response) {
        HoldingsResponse parsed = parser.parse(response, HoldingsResponse.class, apiName);
        if (parsed.entry() == null) {
            throw new MalformedResponseException("Problem with " + apiName + " response: missing 'entry' array");
        }
        for (HoldingsResponse.Entry entry : parsed.entry()) {
            if (entry == null || entry.requestedOclcNumber() == null || entry.httpStatusCode() == null) {
                throw new MalformedResponseException("Problem with " + apiName + " response: incomplete entry " + entry);
            }
        }
        return parsed.entry();
    }
}
