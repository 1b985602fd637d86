package com.spreadsheet.engine.models;

/**
 * Whole-sheet snapshot handed to the undo/redo collaborator: the text and value of every cell.
 * The dependency graph is not stored; it is derived again from the texts on restore.
 */
public final class SheetState {
    private final int rows;
    private final int columns;
    private final String[][] texts;
    private final CellValue[][] values;

    public SheetState(int rows, int columns, String[][] texts, CellValue[][] values) {
        this.rows = rows;
        this.columns = columns;
        this.texts = new String[rows][];
        this.values = new CellValue[rows][];
        for (int r = 0; r < rows; r++) {
            this.texts[r] = texts[r].clone();
            this.values[r] = values[r].clone();
        }
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public String getText(int row, int column) {
        return texts[row][column];
    }

    public CellValue getValue(int row, int column) {
        return values[row][column];
    }
}
