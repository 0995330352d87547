package com.donorid.exception;

/**
 * A source table is absent or lacks a required column. Aborts the whole run.
 */
public class SourceTableException extends RuntimeException {

    private final String table;

    public SourceTableException(String table, String message) {
        super("Source table '" + table + "': " + message);
        this.table = table;
    }

    public String getTable() {
        return table;
    }
}
