package com.catalogsync.worldcat.classifier;

import com.catalogsync.domain.OutcomeCategory;
import com.catalogsync.domain.RecordOperation;
import com.catalogsync.worldcat.adapter.ApiResponse;
import com.catalogsync.worldcat.buffer.DictBuffer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Routes each check-control-numbers entry to current, old or error.
 */
@RequiredArgsConstructor
@Slf4j
public class CurrentNumberClassifier {

    private static final String API_NAME = RecordOperation.GET_CURRENT_NUMBER.getApiName();

    private final ResponseBodyParser parser;

    public void classify(ApiResponse response, DictBuffer buffer, OutcomeRecorder recorder) {
        List<ControlNumbersResponse.Entry> entries = parseEntries(response);
        for (ControlNumbersResponse.Entry entry : entries) {
            String requested = entry.requestedOclcNumber();
            String mmsId = buffer.mmsIdFor(requested).orElseThrow(() -> new IllegalStateException(
                    "Response entry for OCLC number " + requested + " has no matching buffered record. " + buffer));
            if (recorder.isRecordedInBatch(requested)) {
                throw new IllegalStateException("Response contains more than one entry for OCLC number " + requested);
            }
            log.debug("Processing MMS ID {} (OCLC number {})", mmsId, requested);

            if (!Boolean.TRUE.equals(entry.found())) {
                log.error("Problem with {} response for MMS ID {}: OCLC number {} not found", API_NAME, mmsId, requested);
                recorder.record(OutcomeCategory.ERROR, requested, List.of(mmsId, requested,
                        "Problem with " + API_NAME + " response: OCLC number not found"));
            } else if (requested.equals(entry.currentOclcNumber())) {
                recorder.record(OutcomeCategory.CURRENT, requested, List.of(mmsId, entry.currentOclcNumber()));
            } else {
                recorder.record(OutcomeCategory.OLD, requested, List.of(mmsId, entry.currentOclcNumber(), requested));
            }
        }
    }

    private List<ControlNumbersResponse.Entry> parseEntries(ApiResponse response) {
        ControlNumbersResponse parsed = parser.parse(response, ControlNumbersResponse.class, API_NAME);
        if (parsed.entry() == null) {
            throw new MalformedResponseException("Problem with " + API_NAME + " response: missing 'entry' array");
        }
        for (ControlNumbersResponse.Entry entry : parsed.entry()) {
            if (entry == null || entry.requestedOclcNumber() == null
                    || (Boolean.TRUE.equals(entry.found()) && entry.currentOclcNumber() == null)) {
                throw new MalformedResponseException("Problem with " + API_NAME + " response: incomplete entry " + entry);
            }
        }
        return parsed.entry();
    }
}
