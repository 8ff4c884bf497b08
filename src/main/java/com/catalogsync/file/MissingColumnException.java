package com.catalogsync.file;

/**
 * Thrown when an input row lacks a column the operation requires. Fatal for the run,
 * since every later row would fail the same way.
 */
public class MissingColumnException extends RuntimeException {

    public MissingColumnException(String column, int rowNumber) {
        super("Input file is missing required column '" + column + "' (row " + rowNumber + ")");
    }
}
