package com.catalogsync.worldcat.job;

import com.catalogsync.common.ValidationException;
import com.catalogsync.domain.OutcomeCategory;
import com.catalogsync.domain.RecordOperation;
import com.catalogsync.domain.ResultCounters;
import com.catalogsync.domain.RunSummary;
import com.catalogsync.file.InputRow;
import com.catalogsync.file.MissingColumnException;
import com.catalogsync.file.RowSource;
import com.catalogsync.worldcat.adapter.ApiResponse;
import com.catalogsync.worldcat.buffer.IdentifierBuffer;
import com.catalogsync.worldcat.classifier.MalformedResponseException;
import com.catalogsync.worldcat.classifier.OutcomeRecorder;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Reads input rows into a buffer and flushes it as one request whenever it reaches the batch size,
 * plus once more at end of input. Every row read ends up in exactly one outcome category.
 * <p>
 * Row-level failures (invalid or duplicate identifiers) are recorded and the run continues.
 * Batch-level failures are attributed to every buffered identifier that has no outcome yet;
 * fatal ones then halt the run and the unread rows are counted as not processed. Identifiers a
 * successfully classified response did not answer get an error row as well.
 * {@link MalformedResponseException} and {@link IllegalStateException} are never recorded; they
 * propagate to the caller.
 *
 * @param <B> buffer variant used by the operation
 */
@Slf4j
public abstract class BatchProcessingDriver<B extends IdentifierBuffer> {

    protected final RecordOperation operation;
    protected final B buffer;
    protected final OutcomeRecorder recorder;
    private final int maxBatchSize;
    private final Set<String> seenKeys = new HashSet<>();

    private int rowsRead;
    private Failure haltingFailure;

    protected BatchProcessingDriver(RecordOperation operation, B buffer, int maxBatchSize, OutcomeRecorder recorder) {
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("Batch size must be at least 1, got " + maxBatchSize);
        }
        this.operation = operation;
        this.buffer = buffer;
        this.maxBatchSize = maxBatchSize;
        this.recorder = recorder;
    }

    public RunSummary run(RowSource rows) {
        log.info("Starting {} run (batch size {})", operation.getApiName(), maxBatchSize);
        Iterator<InputRow> iterator = rows.iterator();
        while (iterator.hasNext() && !isHalted()) {
            InputRow row = iterator.next();
            rowsRead++;
            bufferRow(row);
            if (!isHalted() && buffer.size() >= maxBatchSize) {
                flush();
            }
        }
        if (isHalted()) {
            drainUnread(iterator);
        } else if (!buffer.isEmpty()) {
            flush();
        }
        afterRun();

        ResultCounters counters = recorder.counters();
        if (counters.total() != rowsRead) {
            throw new ConsistencyCheckException("Read " + rowsRead + " row(s) but accounted for " + counters.total()
                    + ": " + counters);
        }
        RunSummary summary = new RunSummary(operation, counters.asMap(), buffer.getNumApiRequestsMade(), rowsRead,
                isHalted(), isHalted() ? haltingFailure.describe() : null);
        log.info(summary.describe());
        return summary;
    }

    /**
     * Validates the row and adds it to the buffer.
     *
     * @throws ValidationException    if the row's identifiers are unusable or already seen
     * @throws MissingColumnException if a required column is absent
     */
    protected abstract void validateAndBuffer(InputRow row);

    /** Error row for a row that never reached the buffer. */
    protected abstract List<String> rowErrorRow(InputRow row, String message);

    /** Error row for a buffered identifier whose batch failed. */
    protected abstract List<String> batchErrorRow(String identifier, String message);

    /**
     * Sends the buffered identifiers and records their outcomes. Stage failures must surface as
     * {@link BatchStageException}, which {@link #runStage} takes care of.
     */
    protected abstract void processBatch();

    /** Request stage then classification stage. */
    protected void requestThenClassify(Supplier<ApiResponse> request, Consumer<ApiResponse> classification) {
        ApiResponse response = runStage(Stage.REQUEST, request);
        runStage(Stage.CLASSIFICATION, () -> {
            classification.accept(response);
            return null;
        });
    }

    /** Hook for per-run statistics once all rows are accounted for. */
    protected void afterRun() {
    }

    /**
     * Records the key for run-scoped duplicate detection.
     *
     * @throws ValidationException if the key was seen earlier in the run
     */
    protected void requireFirstOccurrence(String key, String fieldName) {
        if (!seenKeys.add(key)) {
            throw new ValidationException(fieldName + " " + key + " appears more than once in the input file");
        }
    }

    protected <T> T runStage(Stage stage, Supplier<T> action) {
        try {
            return action.get();
        } catch (MalformedResponseException | IllegalStateException | BatchStageException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BatchStageException(stage, e);
        }
    }

    public boolean isHalted() {
        return haltingFailure != null;
    }

    public int getRowsRead() {
        return rowsRead;
    }

    private void bufferRow(InputRow row) {
        try {
            validateAndBuffer(row);
        } catch (ValidationException | MissingColumnException e) {
            handle(Failure.of(FailureScope.ROW_LEVEL, Stage.VALIDATION, e), row);
        }
    }

    private void flush() {
        log.debug("Flushing {} record(s). {}", buffer.size(), buffer);
        recorder.beginBatch();
        try {
            processBatch();
            int unanswered = attribute(Failure.unanswered(operation));
            if (unanswered > 0) {
                log.error("{} record(s) in the batch got no entry in the {} response", unanswered,
                        operation.getApiName());
            }
        } catch (BatchStageException e) {
            handle(Failure.of(FailureScope.BATCH_LEVEL, e.getStage(), e.getCause()), null);
        } finally {
            buffer.clear();
        }
    }

    /**
     * Row-level failures produce one error row for the offending row; batch-level failures an error
     * row for every buffered identifier without an outcome. A fatal failure also attributes the
     * buffered identifiers, which then never reach the API, and halts the run.
     */
    private void handle(Failure failure, InputRow row) {
        switch (failure.scope()) {
            case ROW_LEVEL -> {
                if (failure.fatal()) {
                    log.error("Row {}: {}", row.displayRowNumber(), failure.message());
                    recorder.beginBatch();
                } else {
                    log.warn("Row {}: {}", row.displayRowNumber(), failure.message());
                }
                recorder.record(OutcomeCategory.ERROR, null, rowErrorRow(row, failure.message()));
                if (failure.fatal()) {
                    attribute(failure);
                    buffer.clear();
                }
            }
            case BATCH_LEVEL -> {
                log.error("{} for batch of {} record(s): {}", failure.stage().getLabel(), buffer.size(),
                        failure.message(), failure.cause());
                attribute(failure);
            }
        }
        if (failure.fatal()) {
            halt(failure);
        }
    }

    /** Records the failure for each buffered identifier without an outcome; returns how many. */
    private int attribute(Failure failure) {
        int attributed = 0;
        for (String identifier : buffer.identifiers()) {
            if (!recorder.isRecordedInBatch(identifier)) {
                recorder.record(OutcomeCategory.ERROR, identifier, batchErrorRow(identifier, failure.describe()));
                attributed++;
            }
        }
        return attributed;
    }

    private void halt(Failure failure) {
        haltingFailure = failure;
        log.error("Halting {} run: {}", operation.getApiName(), failure.describe());
    }

    private void drainUnread(Iterator<InputRow> iterator) {
        int unread = 0;
        while (iterator.hasNext()) {
            iterator.next();
            unread++;
        }
        if (unread > 0) {
            rowsRead += unread;
            recorder.counters().add(OutcomeCategory.NOT_PROCESSED, unread);
            log.warn("{} row(s) not processed because the run halted", unread);
        }
    }
}
