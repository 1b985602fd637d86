package com.spreadsheet.engine.models;

import com.spreadsheet.engine.exceptions.SheetBoundsException;
import com.spreadsheet.engine.graph.DependencyGraph;

import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents the whole spreadsheet:
 * - Fixed dimensions, set once at creation
 * - A dense grid of Cells (the cell store)
 * - The dependency graph between those cells
 * - A read/write lock; the grid and the graph only change together, under the write lock
 */
public class Sheet {

    public static final int MAX_ROWS = 999;
    public static final int MAX_COLUMNS = 18278;

    private final int rows;
    private final int columns;
    private final Cell[][] cells;
    private final DependencyGraph graph = new DependencyGraph();

    // Lock to prevent race conditions when multiple threads use the same Sheet
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Sheet(int rows, int columns) {
        if (rows < 1 || rows > MAX_ROWS || columns < 1 || columns > MAX_COLUMNS) {
            throw new SheetBoundsException("Invalid dimensions " + rows + "x" + columns
                    + ". Rows: 1-" + MAX_ROWS + ", Columns: 1-" + MAX_COLUMNS);
        }
        this.rows = rows;
        this.columns = columns;
        this.cells = new Cell[rows][columns];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                cells[r][c] = new Cell(new Address(r, c));
            }
        }
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public Cell getCell(Address address) {
        checkBounds(address);
        return cells[address.getRow()][address.getColumn()];
    }

    public Cell getCell(int row, int column) {
        return getCell(new Address(row, column));
    }

    public DependencyGraph getGraph() {
        return graph;
    }

    public boolean contains(Address address) {
        return address.isWithin(rows, columns);
    }

    public void checkBounds(Address address) {
        if (!contains(address)) {
            throw new SheetBoundsException("Address " + address + " is outside the " + rows + "x" + columns + " sheet");
        }
    }

    public void checkBounds(CellRange range) {
        if (!range.isWithin(rows, columns)) {
            throw new SheetBoundsException("Range " + range + " is outside the " + rows + "x" + columns + " sheet");
        }
    }

    /**
     * Empties every cell and drops all edges.
     */
    public void clear() {
        for (Cell[] row : cells) {
            for (Cell cell : row) {
                cell.reset();
            }
        }
        graph.clear();
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
