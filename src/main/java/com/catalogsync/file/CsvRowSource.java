package com.catalogsync.file;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads input rows from a CSV file whose first line is the header. Every cell is kept as a string.
 * A row with fewer cells than the header gets empty strings for the missing trailing cells, so
 * only a column absent from the header is reported as missing.
 */
@Slf4j
public class CsvRowSource implements RowSource, Closeable {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setTrim(false)
            .build();

    private final CSVParser parser;
    private boolean iterated;

    public CsvRowSource(Reader reader) {
        try {
            this.parser = FORMAT.parse(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read CSV header", e);
        }
    }

    public static CsvRowSource open(Path path) throws IOException {
        if (!path.getFileName().toString().toLowerCase().endsWith(".csv")) {
            throw new IllegalArgumentException("Invalid format for input file (" + path + "). Must be a CSV file (.csv)");
        }
        log.debug("Reading input rows from {}", path);
        return new CsvRowSource(Files.newBufferedReader(path, StandardCharsets.UTF_8));
    }

    @Override
    public Iterator<InputRow> iterator() {
        if (iterated) {
            throw new IllegalStateException("CsvRowSource can only be iterated once");
        }
        iterated = true;
        Iterator<CSVRecord> records = parser.iterator();
        return new Iterator<>() {
            private int index;

            @Override
            public boolean hasNext() {
                return records.hasNext();
            }

            @Override
            public InputRow next() {
                CSVRecord record = records.next();
                Map<String, String> fields = new LinkedHashMap<>();
                for (String column : parser.getHeaderNames()) {
                    fields.put(column, record.isSet(column) ? record.get(column) : "");
                }
                if (!record.isConsistent()) {
                    log.debug("Row {} has {} cell(s) for {} header column(s)", index + 2, record.size(),
                            parser.getHeaderNames().size());
                }
                return new InputRow(index++, fields);
            }
        };
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }
}
