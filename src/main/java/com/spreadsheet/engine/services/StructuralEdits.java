package com.spreadsheet.engine.services;

import com.spreadsheet.engine.models.Address;
import com.spreadsheet.engine.models.CellRange;
import com.spreadsheet.engine.models.CellValue;
import com.spreadsheet.engine.models.Reference;

import java.util.Comparator;
import java.util.List;

/**
 * Reference arithmetic for row/column deletion and paste, and the ordering used by sort.
 * A null result means the reference no longer points anywhere and becomes #REF!.
 */
final class StructuralEdits {

    private StructuralEdits() {
    }

    static Reference afterRowDeletion(Reference ref, int deletedRow) {
        CellRange r = ref.getRange();
        if (ref.isSingle()) {
            int row = r.getTopLeft().getRow();
            if (row == deletedRow) {
                return null;
            }
            return row > deletedRow ? Reference.single(r.getTopLeft().offset(-1, 0)) : ref;
        }
        int top = shiftedStart(r.getTopLeft().getRow(), deletedRow);
        int bottom = shiftedEnd(r.getBottomRight().getRow(), deletedRow);
        if (bottom < top) {
            return null;
        }
        return Reference.range(new Address(top, r.getTopLeft().getColumn()), new Address(bottom, r.getBottomRight().getColumn()));
    }

    static Reference afterColumnDeletion(Reference ref, int deletedColumn) {
        CellRange r = ref.getRange();
        if (ref.isSingle()) {
            int column = r.getTopLeft().getColumn();
            if (column == deletedColumn) {
                return null;
            }
            return column > deletedColumn ? Reference.single(r.getTopLeft().offset(0, -1)) : ref;
        }
        int left = shiftedStart(r.getTopLeft().getColumn(), deletedColumn);
        int right = shiftedEnd(r.getBottomRight().getColumn(), deletedColumn);
        if (right < left) {
            return null;
        }
        return Reference.range(new Address(r.getTopLeft().getRow(), left), new Address(r.getBottomRight().getRow(), right));
    }

    // A range's first line moves up only when the deleted line is before it
    private static int shiftedStart(int start, int deleted) {
        return start > deleted ? start - 1 : start;
    }

    // A range's last line moves up when the deleted line is inside or before it
    private static int shiftedEnd(int end, int deleted) {
        return end >= deleted ? end - 1 : end;
    }

    /**
     * Moves a reference by (rowDelta, columnDelta); null if any corner leaves the sheet.
     */
    static Reference translate(Reference ref, int rowDelta, int columnDelta, int rows, int columns) {
        Address topLeft = ref.getRange().getTopLeft().offset(rowDelta, columnDelta);
        Address bottomRight = ref.getRange().getBottomRight().offset(rowDelta, columnDelta);
        if (!topLeft.isWithin(rows, columns) || !bottomRight.isWithin(rows, columns)) {
            return null;
        }
        return ref.isSingle() ? Reference.single(topLeft) : Reference.range(topLeft, bottomRight);
    }

    /**
     * Stable sort of values; errors always go after numbers, in their original order.
     */
    static void sortValues(List<CellValue> values, boolean ascending) {
        Comparator<CellValue> byNumber = Comparator.comparingLong(CellValue::getNumber);
        Comparator<CellValue> numeric = ascending ? byNumber : byNumber.reversed();
        values.sort((a, b) -> {
            if (a.isError() || b.isError()) {
                return Boolean.compare(a.isError(), b.isError());
            }
            return numeric.compare(a, b);
        });
    }
}
