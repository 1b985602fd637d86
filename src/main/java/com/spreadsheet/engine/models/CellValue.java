package com.spreadsheet.engine.models;

import java.util.Objects;

/**
 * The computed content of a cell: an integer, or one of the {@link ErrorKind}s.
 */
public final class CellValue {

    public static final CellValue ZERO = new CellValue(0L, null);

    private final long number;
    private final ErrorKind error;

    private CellValue(long number, ErrorKind error) {
        this.number = number;
        this.error = error;
    }

    public static CellValue of(long number) {
        return number == 0L ? ZERO : new CellValue(number, null);
    }

    public static CellValue error(ErrorKind error) {
        return new CellValue(0L, Objects.requireNonNull(error));
    }

    public boolean isError() {
        return error != null;
    }

    /**
     * Numeric value; 0 for an error value.
     */
    public long getNumber() {
        return number;
    }

    /**
     * The error kind, or null when this value is a number.
     */
    public ErrorKind getError() {
        return error;
    }

    /**
     * Text that parses back to this value as a literal: "42", "-7" or an error code.
     */
    public String toLiteral() {
        return isError() ? error.getCode() : Long.toString(number);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue)) {
            return false;
        }
        CellValue other = (CellValue) o;
        return number == other.number && error == other.error;
    }

    @Override
    public int hashCode() {
        return Objects.hash(number, error);
    }

    @Override
    public String toString() {
        return toLiteral();
    }
}
