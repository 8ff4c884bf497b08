package com.catalogsync.file;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvRowSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void iterator_readsRowsAfterHeader() throws Exception {
        Path input = tempDir.resolve("input.csv");
        Files.writeString(input, "MMS ID,OCLC Number\n991,00123\n992, 456 \n");

        List<InputRow> rows = new ArrayList<>();
        try (CsvRowSource source = CsvRowSource.open(input)) {
            source.forEach(rows::add);
        }

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).index()).isZero();
        assertThat(rows.get(0).displayRowNumber()).isEqualTo(2);
        assertThat(rows.get(0).get("OCLC Number")).isEqualTo("00123");
        assertThat(rows.get(1).get("OCLC Number")).isEqualTo(" 456 ");
    }

    @Test
    void get_absentColumn_throwsMissingColumn() throws Exception {
        try (CsvRowSource source = new CsvRowSource(new StringReader("OCLC Number\n123\n"))) {
            InputRow row = source.iterator().next();

            assertThatThrownBy(() -> row.get("MMS ID"))
                    .isInstanceOf(MissingColumnException.class)
                    .hasMessageContaining("'MMS ID'")
                    .hasMessageContaining("row 2");
            assertThat(row.getOptional("MMS ID")).isEmpty();
        }
    }

    @Test
    void iterator_shortRow_missingTrailingCellsAreEmpty() throws Exception {
        try (CsvRowSource source = new CsvRowSource(new StringReader("MMS ID,OCLC Number\n992\n"))) {
            InputRow row = source.iterator().next();

            assertThat(row.get("MMS ID")).isEqualTo("992");
            assertThat(row.get("OCLC Number")).isEmpty();
        }
    }

    @Test
    void getAny_prefersFirstPresentColumn() throws Exception {
        try (CsvRowSource source = new CsvRowSource(new StringReader("OCLC Number,035$a\n1,2\n"))) {
            InputRow row = source.iterator().next();

            assertThat(row.getAny(List.of("035$a", "OCLC Number"))).isEqualTo("2");
            assertThatThrownBy(() -> row.getAny(List.of("A", "B")))
                    .isInstanceOf(MissingColumnException.class)
                    .hasMessageContaining("'A' or 'B'");
        }
    }

    @Test
    void iterator_secondCall_throws() throws Exception {
        try (CsvRowSource source = new CsvRowSource(new StringReader("a\n1\n"))) {
            source.iterator();
            assertThatThrownBy(source::iterator).isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    void open_nonCsvExtension_rejected() {
        assertThatThrownBy(() -> CsvRowSource.open(tempDir.resolve("input.xlsx")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Must be a CSV file");
    }
}
