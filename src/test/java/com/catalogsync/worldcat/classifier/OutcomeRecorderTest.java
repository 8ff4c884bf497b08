package com.catalogsync.worldcat.classifier;

import com.catalogsync.domain.OutcomeCategory;
import com.catalogsync.domain.RecordOperation;
import com.catalogsync.domain.ResultCounters;
import com.catalogsync.file.TestSinks;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutcomeRecorderTest {

    @Test
    void record_writesHeaderOnlyOnce() {
        TestSinks sinks = new TestSinks(RecordOperation.SEARCH);
        ResultCounters counters = new ResultCounters(RecordOperation.SEARCH);
        OutcomeRecorder recorder = new OutcomeRecorder(RecordOperation.SEARCH, sinks.outcomeSinks(), counters, "TST");

        recorder.record(OutcomeCategory.ZERO_OR_MULTIPLE_MATCHES, "1", List.of("1", "0", "3"));
        recorder.record(OutcomeCategory.ZERO_OR_MULTIPLE_MATCHES, "2", List.of("2", "2", ""));

        assertThat(sinks.get(OutcomeCategory.ZERO_OR_MULTIPLE_MATCHES).rows()).containsExactly(
                List.of("MMS ID", "Num Records Held By TST", "Num Records Total"),
                List.of("1", "0", "3"),
                List.of("2", "2", ""));
        assertThat(counters.get(OutcomeCategory.ZERO_OR_MULTIPLE_MATCHES)).isEqualTo(2);
    }

    @Test
    void beginBatch_forgetsRecordedIdentifiers() {
        TestSinks sinks = new TestSinks(RecordOperation.SET_HOLDING);
        OutcomeRecorder recorder = new OutcomeRecorder(RecordOperation.SET_HOLDING, sinks.outcomeSinks(),
                new ResultCounters(RecordOperation.SET_HOLDING), "TST");

        recorder.record(OutcomeCategory.UPDATED, "123", List.of("123", "", ""));
        assertThat(recorder.isRecordedInBatch("123")).isTrue();

        recorder.beginBatch();
        assertThat(recorder.isRecordedInBatch("123")).isFalse();
    }

    @Test
    void record_categoryOfAnotherOperation_rejected() {
        TestSinks sinks = new TestSinks(RecordOperation.SET_HOLDING);
        OutcomeRecorder recorder = new OutcomeRecorder(RecordOperation.SET_HOLDING, sinks.outcomeSinks(),
                new ResultCounters(RecordOperation.SET_HOLDING), "TST");

        assertThatThrownBy(() -> recorder.record(OutcomeCategory.CURRENT, "1", List.of("1")))
                .isInstanceOf(IllegalStateException.class);
    }
}
