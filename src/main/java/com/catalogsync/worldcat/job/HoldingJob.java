package com.catalogsync.worldcat.job;

import com.catalogsync.common.IdentifierValidator;
import com.catalogsync.domain.Cascade;
import com.catalogsync.domain.RecordOperation;
import com.catalogsync.file.InputRow;
import com.catalogsync.worldcat.adapter.BulkRequestDispatcher;
import com.catalogsync.worldcat.buffer.SetBuffer;
import com.catalogsync.worldcat.classifier.HoldingClassifier;
import com.catalogsync.worldcat.classifier.OutcomeRecorder;

import java.util.List;
import java.util.Map;

/**
 * Sets or unsets the institution's WorldCat holding for each OCLC number in the input.
 */
public class HoldingJob extends BatchProcessingDriver<SetBuffer> {

    public static final String COL_OCLC_NUMBER = "OCLC Number";

    private final BulkRequestDispatcher dispatcher;
    private final HoldingClassifier classifier;
    private final Map<String, String> extraParams;

    /**
     * @param cascade required for {@link RecordOperation#UNSET_HOLDING}, ignored for set
     */
    public HoldingJob(RecordOperation operation,
                      Cascade cascade,
                      SetBuffer buffer,
                      int maxBatchSize,
                      OutcomeRecorder recorder,
                      BulkRequestDispatcher dispatcher,
                      HoldingClassifier classifier) {
        super(operation, buffer, maxBatchSize, recorder);
        if (operation == RecordOperation.UNSET_HOLDING && cascade == null) {
            throw new IllegalArgumentException("Unset holding requires a cascade value");
        }
        this.dispatcher = dispatcher;
        this.classifier = classifier;
        this.extraParams = operation == RecordOperation.UNSET_HOLDING
                ? Map.of(BulkRequestDispatcher.PARAM_CASCADE, String.valueOf(cascade.getValue()))
                : Map.of();
    }

    @Override
    protected void validateAndBuffer(InputRow row) {
        String oclcNumber = IdentifierValidator.stripLeadingZeros(
                IdentifierValidator.validate(row.get(COL_OCLC_NUMBER), COL_OCLC_NUMBER));
        requireFirstOccurrence(oclcNumber, "OCLC number");
        buffer.add(oclcNumber);
    }

    @Override
    protected List<String> rowErrorRow(InputRow row, String message) {
        return List.of(row.getOptional(COL_OCLC_NUMBER).strip(), "", message);
    }

    @Override
    protected List<String> batchErrorRow(String identifier, String message) {
        return List.of(identifier, "", message);
    }

    @Override
    protected void processBatch() {
        requestThenClassify(
                () -> dispatcher.dispatch(operation, buffer, extraParams),
                response -> classifier.classify(response, buffer, recorder));
    }
}
