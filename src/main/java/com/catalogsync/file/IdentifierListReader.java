package com.catalogsync.file;

import com.catalogsync.common.IdentifierValidator;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Reads one column of OCLC numbers from a CSV or text file into a set. A first-row value that is a
 * known column heading is skipped. Values are stripped of surrounding quotes and the {@code (OCoLC)}
 * prefix; numeric values lose their leading zeros. Non-numeric values are kept and logged.
 */
@Slf4j
public final class IdentifierListReader {

    static final Set<String> COLUMN_HEADINGS = Set.of("MMS ID", "OCLC Number", "035$a");
    static final String OCLC_ORG_CODE_PREFIX = "(OCoLC)";

    private IdentifierListReader() {
    }

    public static Set<String> read(Path path) throws IOException {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (!name.endsWith(".csv") && !name.endsWith(".txt")) {
            throw new IllegalArgumentException("Invalid file format (" + path
                    + "). Must be one of the following file formats: CSV (.csv) or text (.txt).");
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        }
    }

    /**
     * @param sourceName used in log messages only
     */
    public static Set<String> read(Reader reader, String sourceName) throws IOException {
        Set<String> values = new LinkedHashSet<>();
        try (CSVParser parser = CSVFormat.DEFAULT.parse(reader)) {
            for (CSVRecord record : parser) {
                if (record.size() == 0) {
                    continue;
                }
                String raw = record.get(0);
                if (record.getRecordNumber() == 1 && COLUMN_HEADINGS.contains(raw)) {
                    continue;
                }
                values.add(normalize(raw, sourceName, record.getRecordNumber()));
            }
        }
        log.debug("Read {} distinct value(s) from {}", values.size(), sourceName);
        return values;
    }

    static String normalize(String raw, String sourceName, long rowNumber) {
        String value = stripQuotes(raw.strip());
        if (value.startsWith(OCLC_ORG_CODE_PREFIX)) {
            value = value.substring(OCLC_ORG_CODE_PREFIX.length()).strip();
        }
        if (!value.isEmpty() && value.chars().allMatch(Character::isDigit)) {
            return IdentifierValidator.stripLeadingZeros(value);
        }
        log.warn("{}, row #{} contains a value with at least one non-digit character: {}", sourceName, rowNumber, value);
        return value;
    }

    private static String stripQuotes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isQuote(value.charAt(start))) {
            start++;
        }
        while (end > start && isQuote(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }
}
