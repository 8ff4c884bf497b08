package com.catalogsync.file;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One row of the input file.
 *
 * @param index  zero-based data row index (header excluded); used only in messages
 * @param fields column name to cell value
 */
public record InputRow(int index, Map<String, String> fields) {

    public InputRow {
        fields = Map.copyOf(fields);
    }

    /**
     * Value of a required column.
     *
     * @throws MissingColumnException if the column is absent from the input's header
     */
    public String get(String column) {
        String value = fields.get(column);
        if (value == null) {
            throw new MissingColumnException(column, displayRowNumber());
        }
        return value;
    }

    /**
     * Value of the first of several accepted column names that the row has.
     *
     * @throws MissingColumnException if none of them is present
     */
    public String getAny(List<String> columns) {
        return columnOf(columns)
                .map(fields::get)
                .orElseThrow(() -> new MissingColumnException(String.join("' or '", columns), displayRowNumber()));
    }

    /** First of the accepted column names present in the row. */
    public Optional<String> columnOf(List<String> columns) {
        return columns.stream().filter(fields::containsKey).findFirst();
    }

    /** Value of an optional column; empty string when absent. */
    public String getOptional(String column) {
        return fields.getOrDefault(column, "");
    }

    /** Row number as shown in a spreadsheet: header is row 1, first data row is row 2. */
    public int displayRowNumber() {
        return index + 2;
    }
}
