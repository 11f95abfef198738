package com.hypmag.exception;

/**
 * A column required by the configuration is missing from the input catalogue.
 */
public class ColumnNotFoundException extends HyperbolicException {

    private final String column;

    public ColumnNotFoundException(String column) {
        super(String.format("column '%s' not found", column));
        this.column = column;
    }

    public ColumnNotFoundException(String role, String column) {
        super(String.format("%s column '%s' not found", role, column));
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
