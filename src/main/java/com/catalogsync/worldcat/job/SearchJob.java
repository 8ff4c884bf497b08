package com.catalogsync.worldcat.job;

import com.catalogsync.common.IdentifierValidator;
import com.catalogsync.domain.OutcomeCategory;
import com.catalogsync.domain.RecordOperation;
import com.catalogsync.file.InputRow;
import com.catalogsync.worldcat.buffer.SearchRecord;
import com.catalogsync.worldcat.buffer.SingleRecordBuffer;
import com.catalogsync.worldcat.classifier.OutcomeRecorder;
import com.catalogsync.worldcat.search.RecordSearcher;
import com.catalogsync.worldcat.search.SearchOutcome;
import com.catalogsync.worldcat.search.SearchQueryBuilder;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Searches WorldCat for each input row's alternate identifiers, one record per batch.
 */
@Slf4j
public class SearchJob extends BatchProcessingDriver<SingleRecordBuffer> {

    public static final String COL_MMS_ID = "mms_id";

    private final RecordSearcher searcher;
    private final boolean searchHeldByFirst;

    private int rowsNeedingOneRequest;
    private int rowsNeedingTwoRequests;

    public SearchJob(SingleRecordBuffer buffer, OutcomeRecorder recorder, RecordSearcher searcher, boolean searchHeldByFirst) {
        super(RecordOperation.SEARCH, buffer, 1, recorder);
        this.searcher = searcher;
        this.searchHeldByFirst = searchHeldByFirst;
    }

    @Override
    protected void validateAndBuffer(InputRow row) {
        String mmsId = IdentifierValidator.validate(row.get(COL_MMS_ID), "MMS ID");
        requireFirstOccurrence(mmsId, "MMS ID");
        Map<String, String> identifiers = new LinkedHashMap<>();
        for (String column : SearchQueryBuilder.IDENTIFIER_COLUMNS) {
            identifiers.put(column, row.getOptional(column));
        }
        buffer.add(new SearchRecord(row.displayRowNumber(), mmsId, identifiers));
    }

    @Override
    protected List<String> rowErrorRow(InputRow row, String message) {
        return List.of(row.getOptional(COL_MMS_ID).strip(), message);
    }

    @Override
    protected List<String> batchErrorRow(String identifier, String message) {
        return List.of(identifier, message);
    }

    /** Query building and both search requests form one stage; the outcome is recorded afterwards. */
    @Override
    protected void processBatch() {
        SearchRecord record = buffer.current()
                .orElseThrow(() -> new IllegalStateException("Search flushed with an empty buffer"));
        SearchOutcome outcome = runStage(Stage.SEARCH, () -> {
            String query = SearchQueryBuilder.build(record);
            log.debug("Row {}: searching WorldCat with query '{}'", record.rowNumber(), query);
            return searcher.search(buffer, query, searchHeldByFirst);
        });
        runStage(Stage.CLASSIFICATION, () -> {
            recordOutcome(record, outcome);
            return null;
        });
    }

    @Override
    protected void afterRun() {
        log.info("{} record(s) needed one API request; {} record(s) needed two", rowsNeedingOneRequest, rowsNeedingTwoRequests);
    }

    public int getRowsNeedingOneRequest() {
        return rowsNeedingOneRequest;
    }

    public int getRowsNeedingTwoRequests() {
        return rowsNeedingTwoRequests;
    }

    private void recordOutcome(SearchRecord record, SearchOutcome outcome) {
        if (outcome.requestsMade() == 1) {
            rowsNeedingOneRequest++;
        } else if (outcome.requestsMade() == 2) {
            rowsNeedingTwoRequests++;
        } else {
            log.warn("For row {}, {} API requests were made when searching WorldCat. The number of API requests per row "
                    + "should be either 1 or 2.", record.rowNumber(), outcome.requestsMade());
        }
        if (outcome.isFound()) {
            log.debug("For row {}, the OCLC Number is {}", record.rowNumber(), outcome.oclcNumber());
            recorder.record(OutcomeCategory.OCLC_NUMBER_FOUND, record.mmsId(), List.of(record.mmsId(), outcome.oclcNumber()));
        } else {
            recorder.record(OutcomeCategory.ZERO_OR_MULTIPLE_MATCHES, record.mmsId(), List.of(record.mmsId(),
                    countOrBlank(outcome.numHeld()), countOrBlank(outcome.numTotal())));
        }
    }

    private static String countOrBlank(Integer count) {
        return count == null ? "" : String.valueOf(count);
    }
}
