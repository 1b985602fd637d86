package com.spreadsheet.engine.models;

import com.spreadsheet.engine.exceptions.FormulaParseException;

import java.util.Objects;

/**
 * A zero-based (row, column) coordinate in the grid.
 * Textual form is column letters followed by a 1-based row number, e.g. "B3" -> (2, 1).
 * Ordering is by row, then column, which is the order cells are evaluated within a layer.
 */
public final class Address implements Comparable<Address> {

    private final int row;
    private final int column;

    public Address(int row, int column) {
        this.row = row;
        this.column = column;
    }

    public static Address of(int row, int column) {
        return new Address(row, column);
    }

    /**
     * Parses "A1"-style notation (case-insensitive). Does not check sheet bounds.
     */
    public static Address parse(String text) {
        String s = text == null ? "" : text.trim();
        int i = 0;
        while (i < s.length() && Character.isLetter(s.charAt(i))) {
            i++;
        }
        if (i == 0 || i == s.length()) {
            throw new FormulaParseException("Malformed cell address: '" + text + "'");
        }
        for (int j = i; j < s.length(); j++) {
            if (!Character.isDigit(s.charAt(j))) {
                throw new FormulaParseException("Malformed cell address: '" + text + "'");
            }
        }
        int column = decodeColumn(s.substring(0, i));
        int row;
        try {
            row = Integer.parseInt(s.substring(i)) - 1;
        } catch (NumberFormatException e) {
            throw new FormulaParseException("Malformed cell address: '" + text + "'");
        }
        if (row < 0 || column < 0) {
            throw new FormulaParseException("Malformed cell address: '" + text + "'");
        }
        return new Address(row, column);
    }

    /**
     * "A" -> 0, "Z" -> 25, "AA" -> 26. Returns -1 when the letters overflow an int.
     */
    public static int decodeColumn(String letters) {
        long result = 0;
        for (int k = 0; k < letters.length(); k++) {
            char c = Character.toUpperCase(letters.charAt(k));
            if (c < 'A' || c > 'Z') {
                return -1;
            }
            result = result * 26 + (c - 'A' + 1);
            if (result > Integer.MAX_VALUE) {
                return -1;
            }
        }
        return (int) result - 1;
    }

    public static String encodeColumn(int column) {
        StringBuilder sb = new StringBuilder();
        int c = column + 1;
        while (c > 0) {
            c--;
            sb.append((char) ('A' + c % 26));
            c /= 26;
        }
        return sb.reverse().toString();
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    public Address offset(int rowDelta, int columnDelta) {
        return new Address(row + rowDelta, column + columnDelta);
    }

    public boolean isWithin(int rows, int columns) {
        return row >= 0 && row < rows && column >= 0 && column < columns;
    }

    @Override
    public int compareTo(Address other) {
        if (row != other.row) {
            return Integer.compare(row, other.row);
        }
        return Integer.compare(column, other.column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Address)) {
            return false;
        }
        Address other = (Address) o;
        return row == other.row && column == other.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, column);
    }

    @Override
    public String toString() {
        return encodeColumn(column) + (row + 1);
    }
}
