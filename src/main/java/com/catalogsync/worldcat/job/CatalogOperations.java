package com.catalogsync.worldcat.job;

import com.catalogsync.domain.Cascade;
import com.catalogsync.domain.RecordOperation;
import com.catalogsync.domain.ResultCounters;
import com.catalogsync.domain.RunSummary;
import com.catalogsync.file.OutcomeSinks;
import com.catalogsync.file.RowSource;
import com.catalogsync.worldcat.adapter.BulkRequestDispatcher;
import com.catalogsync.worldcat.buffer.DictBuffer;
import com.catalogsync.worldcat.buffer.SetBuffer;
import com.catalogsync.worldcat.buffer.SingleRecordBuffer;
import com.catalogsync.worldcat.classifier.CurrentNumberClassifier;
import com.catalogsync.worldcat.classifier.HoldingClassifier;
import com.catalogsync.worldcat.classifier.OutcomeRecorder;
import com.catalogsync.worldcat.classifier.ResponseBodyParser;
import com.catalogsync.worldcat.config.WorldCatProperties;
import com.catalogsync.worldcat.search.RecordSearcher;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Entry points for the bulk WorldCat operations. Each call is one run with its own buffer and counters;
 * the caller owns the row source and the sinks.
 */
@Component
@RequiredArgsConstructor
public class CatalogOperations {

    private final BulkRequestDispatcher dispatcher;
    private final ResponseBodyParser parser;
    private final WorldCatProperties properties;

    public RunSummary getCurrentNumber(RowSource rows, int maxBatchSize, OutcomeSinks sinks) {
        CurrentNumberJob job = new CurrentNumberJob(new DictBuffer(), checkBatchSize(maxBatchSize),
                recorder(RecordOperation.GET_CURRENT_NUMBER, sinks), dispatcher, new CurrentNumberClassifier(parser));
        return job.run(rows);
    }

    public RunSummary setHolding(RowSource rows, int maxBatchSize, OutcomeSinks sinks) {
        return holdings(RecordOperation.SET_HOLDING, null, rows, maxBatchSize, sinks);
    }

    public RunSummary unsetHolding(RowSource rows, int maxBatchSize, Cascade cascade, OutcomeSinks sinks) {
        return holdings(RecordOperation.UNSET_HOLDING, cascade, rows, maxBatchSize, sinks);
    }

    public RunSummary search(RowSource rows, boolean searchHeldByFirst, OutcomeSinks sinks) {
        RecordSearcher searcher = new RecordSearcher(dispatcher, parser, properties.getInstitutionSymbol());
        SearchJob job = new SearchJob(new SingleRecordBuffer(), recorder(RecordOperation.SEARCH, sinks), searcher,
                searchHeldByFirst);
        return job.run(rows);
    }

    private RunSummary holdings(RecordOperation operation, Cascade cascade, RowSource rows, int maxBatchSize,
                                OutcomeSinks sinks) {
        HoldingJob job = new HoldingJob(operation, cascade, new SetBuffer(), checkBatchSize(maxBatchSize),
                recorder(operation, sinks), dispatcher, new HoldingClassifier(parser, operation));
        return job.run(rows);
    }

    private OutcomeRecorder recorder(RecordOperation operation, OutcomeSinks sinks) {
        return new OutcomeRecorder(operation, sinks, new ResultCounters(operation), properties.getInstitutionSymbol());
    }

    private int checkBatchSize(int maxBatchSize) {
        if (maxBatchSize < 1 || maxBatchSize > properties.getMaxRecordsPerRequest()) {
            throw new IllegalArgumentException("Batch size must be between 1 and "
                    + properties.getMaxRecordsPerRequest() + ", got " + maxBatchSize);
        }
        return maxBatchSize;
    }
}
