package com.spreadsheet.engine.services;

import com.spreadsheet.engine.config.SheetProperties;
import com.spreadsheet.engine.exceptions.CircularReferenceException;
import com.spreadsheet.engine.exceptions.FormulaParseException;
import com.spreadsheet.engine.exceptions.SheetBoundsException;
import com.spreadsheet.engine.formula.FormulaEvaluator;
import com.spreadsheet.engine.formula.FormulaRewriter;
import com.spreadsheet.engine.formula.ParsedFormula;
import com.spreadsheet.engine.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.function.Function;

/**
 * Main entry point for the session's sheet: setting and reading cells,
 * row/column deletion, copy/cut/paste, sort, and whole-sheet snapshots.
 * Every call runs under the sheet's lock, so callers only ever see fully committed states.
 */
@Service
public class SheetService {

    private static final Logger logger = LoggerFactory.getLogger(SheetService.class);

    private final Sheet sheet;
    private final RecalculationEngine engine;

    @Autowired
    public SheetService(SheetProperties properties) {
        this(properties.getRows(), properties.getColumns());
    }

    public SheetService(int rows, int columns) {
        this(rows, columns, new FormulaEvaluator());
    }

    public SheetService(int rows, int columns, FormulaEvaluator evaluator) {
        this.sheet = new Sheet(rows, columns);
        this.engine = new RecalculationEngine(sheet, evaluator);
        logger.info("Created {}x{} sheet", rows, columns);
    }

    public int getRows() {
        return sheet.getRows();
    }

    public int getColumns() {
        return sheet.getColumns();
    }

    /**
     * Sets a cell's text (blank, a number, or a formula) and recalculates everything that
     * depends on it. On rejection nothing in the sheet changes.
     *
     * @throws SheetBoundsException       if the address is outside the sheet
     * @throws FormulaParseException      if the text is not a valid number or formula
     * @throws CircularReferenceException if the formula would make the cell depend on itself
     */
    public RecalculationResult setCell(Address address, String text) {
        Lock lock = sheet.getLock().writeLock();
        lock.lock();
        try {
            return engine.commit(address, text);
        } catch (SheetBoundsException | FormulaParseException | CircularReferenceException ex) {
            logger.warn("Rejected {} = '{}': {}", address, text, ex.getMessage());
            throw ex;
        } finally {
            lock.unlock();
        }
    }

    public RecalculationResult setCell(String address, String text) {
        return setCell(Address.parse(address), text);
    }

    public CellView getCell(Address address) {
        Lock lock = sheet.getLock().readLock();
        lock.lock();
        try {
            Cell cell = sheet.getCell(address);
            return new CellView(address, cell.getText(), cell.getValue(), cell.isFormula());
        } finally {
            lock.unlock();
        }
    }

    public CellView getCell(String address) {
        return getCell(Address.parse(address));
    }

    /**
     * Values of every non-empty cell, in row-major order.
     */
    public Map<Address, CellValue> getSheetData() {
        Lock lock = sheet.getLock().readLock();
        lock.lock();
        try {
            Map<Address, CellValue> data = new LinkedHashMap<>();
            for (int r = 0; r < sheet.getRows(); r++) {
                for (int c = 0; c < sheet.getColumns(); c++) {
                    Cell cell = sheet.getCell(r, c);
                    if (!cell.isEmpty()) {
                        data.put(cell.getAddress(), cell.getValue());
                    }
                }
            }
            return data;
        } finally {
            lock.unlock();
        }
    }

    /**
     * For each cell with a formula => the references it reads.
     */
    public Map<Address, Set<Reference>> getForwardDependencies() {
        Lock lock = sheet.getLock().readLock();
        lock.lock();
        try {
            return sheet.getGraph().forwardView();
        } finally {
            lock.unlock();
        }
    }

    /**
     * For each cell that is read => the cells reading it.
     */
    public Map<Address, Set<Address>> getReverseDependencies() {
        Lock lock = sheet.getLock().readLock();
        lock.lock();
        try {
            return sheet.getGraph().reverseView();
        } finally {
            lock.unlock();
        }
    }

    // ----------------------------------------------------------------
    // Structural operations
    // ----------------------------------------------------------------

    /**
     * Removes a row; rows below move up one and references are rewritten to match.
     * References into the removed row become #REF!.
     */
    public void deleteRow(int row) {
        if (row < 0 || row >= sheet.getRows()) {
            throw new SheetBoundsException("Row index " + row + " is outside the sheet (0-" + (sheet.getRows() - 1) + ")");
        }
        Lock lock = sheet.getLock().writeLock();
        lock.lock();
        try {
            String[][] texts = emptyGrid();
            for (int r = 0; r < sheet.getRows(); r++) {
                if (r == row) {
                    continue;
                }
                for (int c = 0; c < sheet.getColumns(); c++) {
                    texts[r > row ? r - 1 : r][c] = rewritten(sheet.getCell(r, c), ref -> StructuralEdits.afterRowDeletion(ref, row));
                }
            }
            List<List<Address>> layers = engine.replaceTexts(texts);
            logger.info("Deleted row {}, re-evaluated {} layer(s)", row + 1, layers.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a column; columns to the right move left one and references are rewritten to match.
     * References into the removed column become #REF!.
     */
    public void deleteColumn(int column) {
        if (column < 0 || column >= sheet.getColumns()) {
            throw new SheetBoundsException("Column index " + column + " is outside the sheet (0-" + (sheet.getColumns() - 1) + ")");
        }
        Lock lock = sheet.getLock().writeLock();
        lock.lock();
        try {
            String[][] texts = emptyGrid();
            for (int r = 0; r < sheet.getRows(); r++) {
                for (int c = 0; c < sheet.getColumns(); c++) {
                    if (c == column) {
                        continue;
                    }
                    texts[r][c > column ? c - 1 : c] = rewritten(sheet.getCell(r, c), ref -> StructuralEdits.afterColumnDeletion(ref, column));
                }
            }
            List<List<Address>> layers = engine.replaceTexts(texts);
            logger.info("Deleted column {}, re-evaluated {} layer(s)", Address.encodeColumn(column), layers.size());
        } finally {
            lock.unlock();
        }
    }

    public Clipboard copy(CellRange range) {
        sheet.checkBounds(range);
        Lock lock = sheet.getLock().readLock();
        lock.lock();
        try {
            return capture(range, false);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copies the range, then clears each source cell. Formulas elsewhere that read the
     * cleared cells now read empty cells.
     */
    public Clipboard cut(CellRange range) {
        sheet.checkBounds(range);
        Lock lock = sheet.getLock().writeLock();
        lock.lock();
        try {
            Clipboard clipboard = capture(range, true);
            for (Address address : range.cells()) {
                engine.commit(address, "");
            }
            logger.info("Cut {}", range);
            return clipboard;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Writes the clipboard at {@code anchor}, shifting every reference by the distance the
     * cells moved. Cells are committed one at a time in row-major order; a cell that falls
     * outside the sheet or would close a cycle is reported and skipped, the rest still commit.
     */
    public PasteReport paste(Clipboard clipboard, Address anchor) {
        sheet.checkBounds(anchor);
        int rowDelta = anchor.getRow() - clipboard.getAnchor().getRow();
        int columnDelta = anchor.getColumn() - clipboard.getAnchor().getColumn();
        PasteReport report = new PasteReport();

        Lock lock = sheet.getLock().writeLock();
        lock.lock();
        try {
            for (int i = 0; i < clipboard.getRowCount(); i++) {
                for (int j = 0; j < clipboard.getColumnCount(); j++) {
                    Address destination = anchor.offset(i, j);
                    if (!sheet.contains(destination)) {
                        report.addRejection(destination, "outside the sheet");
                        continue;
                    }
                    try {
                        ParsedFormula parsed = engine.getParser().parse(clipboard.getText(i, j));
                        String text = FormulaRewriter.rewrite(parsed, ref -> StructuralEdits.translate(
                                ref, rowDelta, columnDelta, sheet.getRows(), sheet.getColumns()));
                        engine.commit(destination, text);
                        report.addPasted(destination);
                    } catch (CircularReferenceException | FormulaParseException ex) {
                        logger.warn("Paste into {} rejected: {}", destination, ex.getMessage());
                        report.addRejection(destination, ex.getMessage());
                    }
                }
            }
            logger.info("Pasted {} at {}: {} cell(s) written, {} rejected",
                    clipboard.getSource(), anchor, report.getPasted().size(), report.getRejections().size());
            return report;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sorts the evaluated values of a range. Every cell in the range ends up holding
     * a plain literal; no formula survives inside the range.
     */
    public void sort(CellRange range, boolean ascending, SortDimension dimension) {
        sheet.checkBounds(range);
        Lock lock = sheet.getLock().writeLock();
        lock.lock();
        try {
            Map<Address, CellValue> sorted = new HashMap<>();
            switch (dimension) {
                case COLUMNS:
                    for (int c = range.getTopLeft().getColumn(); c <= range.getBottomRight().getColumn(); c++) {
                        sortInto(new CellRange(new Address(range.getTopLeft().getRow(), c),
                                new Address(range.getBottomRight().getRow(), c)), ascending, sorted);
                    }
                    break;
                case ROWS:
                    for (int r = range.getTopLeft().getRow(); r <= range.getBottomRight().getRow(); r++) {
                        sortInto(new CellRange(new Address(r, range.getTopLeft().getColumn()),
                                new Address(r, range.getBottomRight().getColumn())), ascending, sorted);
                    }
                    break;
                case WHOLE_RANGE:
                    sortInto(range, ascending, sorted);
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported sort dimension " + dimension);
            }
            for (Address address : range.cells()) {
                engine.commit(address, sorted.get(address).toLiteral());
            }
            logger.info("Sorted {} {} by {}", range, ascending ? "ascending" : "descending", dimension);
        } finally {
            lock.unlock();
        }
    }

    // ----------------------------------------------------------------
    // Snapshots for undo/redo
    // ----------------------------------------------------------------

    public SheetState snapshot() {
        Lock lock = sheet.getLock().readLock();
        lock.lock();
        try {
            String[][] texts = new String[sheet.getRows()][sheet.getColumns()];
            CellValue[][] values = new CellValue[sheet.getRows()][sheet.getColumns()];
            for (int r = 0; r < sheet.getRows(); r++) {
                for (int c = 0; c < sheet.getColumns(); c++) {
                    Cell cell = sheet.getCell(r, c);
                    texts[r][c] = cell.getText();
                    values[r][c] = cell.getValue();
                }
            }
            return new SheetState(sheet.getRows(), sheet.getColumns(), texts, values);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Puts a snapshot back. A snapshot whose texts do not parse, or whose formulas form a cycle,
     * is rejected and the sheet keeps its current contents.
     */
    public void restore(SheetState state) {
        if (state.getRows() != sheet.getRows() || state.getColumns() != sheet.getColumns()) {
            throw new SheetBoundsException("Snapshot is " + state.getRows() + "x" + state.getColumns()
                    + " but the sheet is " + sheet.getRows() + "x" + sheet.getColumns());
        }
        Lock lock = sheet.getLock().writeLock();
        lock.lock();
        try {
            engine.load(state);
            logger.info("Restored sheet snapshot");
        } catch (FormulaParseException | CircularReferenceException ex) {
            logger.warn("Rejected snapshot: {}", ex.getMessage());
            throw ex;
        } finally {
            lock.unlock();
        }
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    private String[][] emptyGrid() {
        String[][] texts = new String[sheet.getRows()][sheet.getColumns()];
        for (String[] row : texts) {
            Arrays.fill(row, "");
        }
        return texts;
    }

    private String rewritten(Cell cell, Function<Reference, Reference> mapping) {
        if (cell.isEmpty()) {
            return "";
        }
        return FormulaRewriter.rewrite(cell.getFormula(), mapping);
    }

    private Clipboard capture(CellRange range, boolean cut) {
        String[][] texts = new String[range.getRowCount()][range.getColumnCount()];
        for (int i = 0; i < range.getRowCount(); i++) {
            for (int j = 0; j < range.getColumnCount(); j++) {
                texts[i][j] = sheet.getCell(range.getTopLeft().offset(i, j)).getText();
            }
        }
        return new Clipboard(range, texts, cut);
    }

    private void sortInto(CellRange part, boolean ascending, Map<Address, CellValue> sorted) {
        List<Address> cells = part.cells();
        List<CellValue> values = new ArrayList<>(cells.size());
        for (Address address : cells) {
            values.add(sheet.getCell(address).getValue());
        }
        StructuralEdits.sortValues(values, ascending);
        for (int i = 0; i < cells.size(); i++) {
            sorted.put(cells.get(i), values.get(i));
        }
    }
}
