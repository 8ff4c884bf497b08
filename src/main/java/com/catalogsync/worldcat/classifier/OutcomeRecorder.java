package com.catalogsync.worldcat.classifier;

import com.catalogsync.domain.OutcomeCategory;
import com.catalogsync.domain.RecordOperation;
import com.catalogsync.domain.ResultCounters;
import com.catalogsync.file.OutcomeSinks;
import com.catalogsync.file.OutputSink;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes outcome rows to the operation's sinks and keeps the per-run counters in step.
 * <p>
 * A sink receives its header the first time anything is appended to an empty destination.
 * Identifiers recorded since {@link #beginBatch()} are remembered so a failed batch only
 * attributes errors to identifiers that have no outcome yet.
 */
@Slf4j
public class OutcomeRecorder {

    private final RecordOperation operation;
    private final OutcomeSinks sinks;
    private final ResultCounters counters;
    private final String institutionSymbol;
    private final Set<String> recordedInBatch = new HashSet<>();

    public OutcomeRecorder(RecordOperation operation, OutcomeSinks sinks, ResultCounters counters, String institutionSymbol) {
        this.operation = operation;
        this.sinks = sinks;
        this.counters = counters;
        this.institutionSymbol = institutionSymbol == null ? "" : institutionSymbol;
    }

    public void beginBatch() {
        recordedInBatch.clear();
    }

    /**
     * Appends one row to the category's sink and increments its counter.
     *
     * @param identifier buffered identifier the row accounts for, or null for a row that never
     *                   reached the buffer
     */
    public void record(OutcomeCategory category, String identifier, List<String> row) {
        OutputSink sink = sinks.get(category);
        if (sink.isEmpty()) {
            sink.append(header(category));
        }
        sink.append(row);
        counters.increment(category);
        if (identifier != null) {
            recordedInBatch.add(identifier);
        }
        log.debug("Recorded {} as {}: {}", identifier, category, row);
    }

    public boolean isRecordedInBatch(String identifier) {
        return recordedInBatch.contains(identifier);
    }

    public ResultCounters counters() {
        return counters;
    }

    public RecordOperation operation() {
        return operation;
    }

    List<String> header(OutcomeCategory category) {
        return switch (operation) {
            case GET_CURRENT_NUMBER -> switch (category) {
                case CURRENT -> List.of("MMS ID", "Current OCLC Number");
                case OLD -> List.of("MMS ID", "Current OCLC Number", "Original OCLC Number");
                case ERROR -> List.of("MMS ID", "OCLC Number", "Error");
                default -> throw unsupported(category);
            };
            case SET_HOLDING, UNSET_HOLDING -> switch (category) {
                case UPDATED -> List.of("Requested OCLC Number", "New OCLC Number (if applicable)", "Warning");
                case NO_UPDATE_NEEDED, ERROR -> List.of("Requested OCLC Number", "New OCLC Number (if applicable)", "Error");
                default -> throw unsupported(category);
            };
            case SEARCH -> switch (category) {
                case OCLC_NUMBER_FOUND -> List.of("MMS ID", "OCLC Number");
                case ZERO_OR_MULTIPLE_MATCHES -> List.of("MMS ID", "Num Records Held By " + institutionSymbol, "Num Records Total");
                case ERROR -> List.of("MMS ID", "Error");
                default -> throw unsupported(category);
            };
        };
    }

    private IllegalArgumentException unsupported(OutcomeCategory category) {
        return new IllegalArgumentException("No output for " + category + " in " + operation);
    }
}
