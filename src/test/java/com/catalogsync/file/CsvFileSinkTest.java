package com.catalogsync.file;

import com.catalogsync.domain.OutcomeCategory;
import com.catalogsync.domain.RecordOperation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CsvFileSinkTest {

    @TempDir
    Path tempDir;

    @Test
    void append_writesQuotedCsvAndFlushes() throws Exception {
        Path file = tempDir.resolve("nested/out.csv");
        try (CsvFileSink sink = new CsvFileSink(file)) {
            assertThat(sink.isEmpty()).isTrue();
            sink.append(List.of("991", "123", "Problem, with comma"));
            assertThat(sink.isEmpty()).isFalse();

            assertThat(Files.readAllLines(file)).containsExactly("991,123,\"Problem, with comma\"");
        }
    }

    @Test
    @DisplayName("reopening a non-empty file appends and reports it as non-empty")
    void reopen_existingFile_appends() throws Exception {
        Path file = tempDir.resolve("out.csv");
        try (CsvFileSink sink = new CsvFileSink(file)) {
            sink.append(List.of("a"));
        }
        try (CsvFileSink sink = new CsvFileSink(file)) {
            assertThat(sink.isEmpty()).isFalse();
            sink.append(List.of("b"));
        }

        assertThat(Files.readAllLines(file)).containsExactly("a", "b");
    }

    @Test
    void outcomeSinks_csv_opensOneFilePerCategory() throws Exception {
        try (OutcomeSinks sinks = OutcomeSinks.csv(tempDir, RecordOperation.SET_HOLDING)) {
            sinks.get(OutcomeCategory.UPDATED).append(List.of("123"));
        }

        assertThat(tempDir.resolve("records_with_holding_successfully_set.csv")).exists();
        assertThat(OutcomeSinks.fileNames(RecordOperation.SEARCH))
                .containsEntry(OutcomeCategory.OCLC_NUMBER_FOUND, "records_with_oclc_num.csv")
                .hasSize(3);
    }
}
