package com.catalogsync.worldcat.job;

import com.catalogsync.common.IdentifierValidator;
import com.catalogsync.common.ValidationException;
import com.catalogsync.domain.RecordOperation;
import com.catalogsync.file.InputRow;
import com.catalogsync.worldcat.adapter.BulkRequestDispatcher;
import com.catalogsync.worldcat.buffer.DictBuffer;
import com.catalogsync.worldcat.classifier.CurrentNumberClassifier;
import com.catalogsync.worldcat.classifier.OutcomeRecorder;

import java.util.List;
import java.util.Map;

/**
 * Looks up the current OCLC number for each (MMS ID, OCLC number) input row. The OCLC number is
 * read from the column written by the Alma record identifier export, or from a plain
 * "OCLC Number" column when the file has no such column.
 */
public class CurrentNumberJob extends BatchProcessingDriver<DictBuffer> {

    public static final String COL_MMS_ID = "MMS ID";
    public static final String COL_ALMA_OCLC_NUMBER = "Unique OCLC Number from Alma Record's 035 $a";
    public static final String COL_OCLC_NUMBER = "OCLC Number";
    static final List<String> OCLC_NUMBER_COLUMNS = List.of(COL_ALMA_OCLC_NUMBER, COL_OCLC_NUMBER);

    private final BulkRequestDispatcher dispatcher;
    private final CurrentNumberClassifier classifier;

    public CurrentNumberJob(DictBuffer buffer,
                            int maxBatchSize,
                            OutcomeRecorder recorder,
                            BulkRequestDispatcher dispatcher,
                            CurrentNumberClassifier classifier) {
        super(RecordOperation.GET_CURRENT_NUMBER, buffer, maxBatchSize, recorder);
        this.dispatcher = dispatcher;
        this.classifier = classifier;
    }

    @Override
    protected void validateAndBuffer(InputRow row) {
        String mmsId = IdentifierValidator.validate(row.get(COL_MMS_ID), COL_MMS_ID);
        String oclcNumber = IdentifierValidator.stripLeadingZeros(
                IdentifierValidator.validate(row.getAny(OCLC_NUMBER_COLUMNS), COL_OCLC_NUMBER));
        buffer.mmsIdFor(oclcNumber).ifPresent(existing -> {
            throw new ValidationException("OCLC number " + oclcNumber
                    + " already exists in records buffer with MMS ID " + existing);
        });
        requireFirstOccurrence(mmsId, COL_MMS_ID);
        buffer.add(oclcNumber, mmsId);
    }

    @Override
    protected List<String> rowErrorRow(InputRow row, String message) {
        String oclcNumber = row.columnOf(OCLC_NUMBER_COLUMNS).map(row::getOptional).orElse("");
        return List.of(row.getOptional(COL_MMS_ID).strip(), oclcNumber.strip(), message);
    }

    @Override
    protected List<String> batchErrorRow(String identifier, String message) {
        return List.of(buffer.mmsIdFor(identifier).orElse(""), identifier, message);
    }

    @Override
    protected void processBatch() {
        requestThenClassify(
                () -> dispatcher.dispatch(operation, buffer, Map.of()),
                response -> classifier.classify(response, buffer, recorder));
    }
}
