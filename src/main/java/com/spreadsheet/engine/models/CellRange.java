package com.spreadsheet.engine.models;

import com.spreadsheet.engine.exceptions.InvalidRangeException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A rectangle of cells given by its top-left and bottom-right corners (both inclusive).
 */
public final class CellRange {

    private final Address topLeft;
    private final Address bottomRight;

    public CellRange(Address topLeft, Address bottomRight) {
        if (topLeft.getRow() > bottomRight.getRow() || topLeft.getColumn() > bottomRight.getColumn()) {
            throw new InvalidRangeException("Range corners out of order: " + topLeft + ":" + bottomRight);
        }
        this.topLeft = topLeft;
        this.bottomRight = bottomRight;
    }

    public static CellRange of(Address topLeft, Address bottomRight) {
        return new CellRange(topLeft, bottomRight);
    }

    /**
     * Parses "A1:B3". A single address ("C2") is accepted as a one-cell range.
     */
    public static CellRange parse(String text) {
        String s = text == null ? "" : text.trim();
        int colon = s.indexOf(':');
        if (colon < 0) {
            Address single = Address.parse(s);
            return new CellRange(single, single);
        }
        return new CellRange(Address.parse(s.substring(0, colon)), Address.parse(s.substring(colon + 1)));
    }

    public Address getTopLeft() {
        return topLeft;
    }

    public Address getBottomRight() {
        return bottomRight;
    }

    public int getRowCount() {
        return bottomRight.getRow() - topLeft.getRow() + 1;
    }

    public int getColumnCount() {
        return bottomRight.getColumn() - topLeft.getColumn() + 1;
    }

    public int size() {
        return getRowCount() * getColumnCount();
    }

    public boolean contains(Address address) {
        return address.getRow() >= topLeft.getRow() && address.getRow() <= bottomRight.getRow()
                && address.getColumn() >= topLeft.getColumn() && address.getColumn() <= bottomRight.getColumn();
    }

    public boolean isWithin(int rows, int columns) {
        return topLeft.isWithin(rows, columns) && bottomRight.isWithin(rows, columns);
    }

    /**
     * Member cells in row-major order: top to bottom, left to right within a row.
     */
    public List<Address> cells() {
        List<Address> cells = new ArrayList<>(size());
        for (int r = topLeft.getRow(); r <= bottomRight.getRow(); r++) {
            for (int c = topLeft.getColumn(); c <= bottomRight.getColumn(); c++) {
                cells.add(new Address(r, c));
            }
        }
        return cells;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellRange)) {
            return false;
        }
        CellRange other = (CellRange) o;
        return topLeft.equals(other.topLeft) && bottomRight.equals(other.bottomRight);
    }

    @Override
    public int hashCode() {
        return Objects.hash(topLeft, bottomRight);
    }

    @Override
    public String toString() {
        return topLeft + ":" + bottomRight;
    }
}
