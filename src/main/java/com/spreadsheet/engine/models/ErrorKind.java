package com.spreadsheet.engine.models;

/**
 * Value-level errors. These are stored in a cell and propagate to its dependents;
 * they never fail the call that produced them.
 * Each kind has a display code which is also accepted as a literal in formula text.
 */
public enum ErrorKind {
    DIVISION_BY_ZERO("#DIV/0!"),
    INVALID_REFERENCE("#REF!"),
    INSUFFICIENT_SAMPLE("#SAMPLE!");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Case-insensitive lookup by display code, or null when the code is unknown.
     */
    public static ErrorKind fromCode(String code) {
        for (ErrorKind kind : values()) {
            if (kind.code.equalsIgnoreCase(code)) {
                return kind;
            }
        }
        return null;
    }
}
