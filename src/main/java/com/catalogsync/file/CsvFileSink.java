package com.catalogsync.file;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * CSV file opened in append mode. Rows are flushed as they are written so that a run halted
 * by a fatal error leaves everything logged so far on disk.
 */
public class CsvFileSink implements OutputSink, Closeable {

    private final Path path;
    private final CSVPrinter printer;
    private boolean empty;

    public CsvFileSink(Path path) throws IOException {
        this.path = path;
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        this.empty = !Files.exists(path) || Files.size(path) == 0;
        this.printer = new CSVPrinter(
                Files.newBufferedWriter(path, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND),
                CSVFormat.DEFAULT);
    }

    @Override
    public boolean isEmpty() {
        return empty;
    }

    @Override
    public void append(List<String> row) {
        try {
            printer.printRecord(row);
            printer.flush();
            empty = false;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append row to " + path, e);
        }
    }

    public Path getPath() {
        return path;
    }

    @Override
    public void close() throws IOException {
        printer.close();
    }
}
