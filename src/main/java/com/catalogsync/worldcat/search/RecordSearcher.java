package com.catalogsync.worldcat.search;

import com.catalogsync.domain.RecordOperation;
import com.catalogsync.worldcat.adapter.ApiResponse;
import com.catalogsync.worldcat.adapter.BulkRequestDispatcher;
import com.catalogsync.worldcat.buffer.SingleRecordBuffer;
import com.catalogsync.worldcat.classifier.MalformedResponseException;
import com.catalogsync.worldcat.classifier.ResponseBodyParser;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;

/**
 * Searches WorldCat for the buffered record in at most two requests.
 * <p>
 * Held-by first: search records held by the institution; when none are held, search all records.
 * Otherwise: search all records; when there is more than one match, narrow with the held-by filter.
 * Stops as soon as exactly one match is found.
 */
@Slf4j
public class RecordSearcher {

    private static final RecordOperation OPERATION = RecordOperation.SEARCH;

    private final BulkRequestDispatcher dispatcher;
    private final ResponseBodyParser parser;
    private final String institutionSymbol;

    public RecordSearcher(BulkRequestDispatcher dispatcher, ResponseBodyParser parser, String institutionSymbol) {
        this.dispatcher = dispatcher;
        this.parser = parser;
        this.institutionSymbol = institutionSymbol == null ? "" : institutionSymbol.strip();
    }

    public SearchOutcome search(SingleRecordBuffer buffer, String query, boolean searchHeldByFirst) {
        int requestsBefore = buffer.getNumApiRequestsMade();
        boolean canFilterByHolding = !institutionSymbol.isEmpty();

        if (searchHeldByFirst && canFilterByHolding) {
            BriefBibsResponse held = request(buffer, query, true);
            int numHeld = held.numberOfRecords();
            if (numHeld > 0) {
                return numHeld == 1
                        ? outcome(firstOclcNumber(held), numHeld, null, buffer, requestsBefore)
                        : outcome(null, numHeld, null, buffer, requestsBefore);
            }
            log.debug("Found no records held by {}. Searching without the \"held by\" filter...", institutionSymbol);
            BriefBibsResponse all = request(buffer, query, false);
            int numTotal = all.numberOfRecords();
            return numTotal == 1
                    ? outcome(firstOclcNumber(all), null, numTotal, buffer, requestsBefore)
                    : outcome(null, numHeld, numTotal, buffer, requestsBefore);
        }

        BriefBibsResponse all = request(buffer, query, false);
        int numTotal = all.numberOfRecords();
        if (numTotal == 1) {
            return outcome(firstOclcNumber(all), null, numTotal, buffer, requestsBefore);
        }
        if (numTotal == 0 || !canFilterByHolding) {
            return outcome(null, null, numTotal, buffer, requestsBefore);
        }
        log.debug("Found {} total records. Searching with a \"held by\" filter to narrow down the results...", numTotal);
        BriefBibsResponse held = request(buffer, query, true);
        int numHeld = held.numberOfRecords();
        return numHeld == 1
                ? outcome(firstOclcNumber(held), numHeld, null, buffer, requestsBefore)
                : outcome(null, numHeld, numTotal, buffer, requestsBefore);
    }

    private BriefBibsResponse request(SingleRecordBuffer buffer, String query, boolean heldByFilter) {
        Map<String, String> params = new HashMap<>();
        params.put(BulkRequestDispatcher.PARAM_QUERY, query);
        params.put(BulkRequestDispatcher.PARAM_LIMIT, "2");
        if (heldByFilter) {
            params.put(BulkRequestDispatcher.PARAM_HELD_BY_SYMBOL, institutionSymbol);
        }
        ApiResponse response = dispatcher.dispatch(OPERATION, buffer, params);
        BriefBibsResponse parsed = parser.parse(response, BriefBibsResponse.class, OPERATION.getApiName());
        if (parsed.numberOfRecords() == null) {
            throw new MalformedResponseException("Problem with " + OPERATION.getApiName()
                    + " response: missing 'numberOfRecords'");
        }
        return parsed;
    }

    private static String firstOclcNumber(BriefBibsResponse response) {
        if (response.briefRecords() == null || response.briefRecords().isEmpty()
                || response.briefRecords().get(0) == null || response.briefRecords().get(0).oclcNumber() == null) {
            throw new MalformedResponseException("Problem with " + OPERATION.getApiName()
                    + " response: one record reported but no OCLC number returned");
        }
        return response.briefRecords().get(0).oclcNumber();
    }

    private static SearchOutcome outcome(String oclcNumber, Integer numHeld, Integer numTotal,
                                         SingleRecordBuffer buffer, int requestsBefore) {
        return new SearchOutcome(oclcNumber, numHeld, numTotal, buffer.getNumApiRequestsMade() - requestsBefore);
    }
}
