package com.spreadsheet.engine.services;

import com.spreadsheet.engine.exceptions.SheetBoundsException;
import com.spreadsheet.engine.formula.FormulaEvaluator;
import com.spreadsheet.engine.models.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Row/column deletion, copy/cut/paste and sort on a 10x10 sheet.
 */
class StructuralOperationsTest {

    private SheetService sheetService;

    @BeforeEach
    void setUp() {
        sheetService = new SheetService(10, 10);
    }

    private CellValue valueOf(String address) {
        return sheetService.getCell(address).getValue();
    }

    private String textOf(String address) {
        return sheetService.getCell(address).getText();
    }

    private static final CellValue REF = CellValue.error(ErrorKind.INVALID_REFERENCE);

    // ----------------------------------------------------------------
    // Deletion
    // ----------------------------------------------------------------

    /**
     * B1 reads A1; after deleting column A the formula (now in A1) reads #REF!.
     */
    @Test
    void testDeleteColumnInvalidatesReference() {
        sheetService.setCell("A1", "4");
        sheetService.setCell("B1", "A1");
        sheetService.setCell("C1", "=B1+1");

        sheetService.deleteColumn(0);

        assertEquals("#REF!", textOf("A1"));
        assertEquals(REF, valueOf("A1"));
        // the reader moved with its input and still sees the error
        assertEquals("=A1+1", textOf("B1"));
        assertEquals(REF, valueOf("B1"));
        assertEquals("", textOf("C1"));
    }

    @Test
    void testDeleteRowShiftsReferences() {
        sheetService.setCell("A1", "1");
        sheetService.setCell("A2", "2");
        sheetService.setCell("A3", "3");
        sheetService.setCell("B4", "SUM(A1:A3)");
        sheetService.setCell("B5", "=A3*2");

        sheetService.deleteRow(1);

        assertEquals("3", textOf("A2"));
        assertEquals("SUM(A1:A2)", textOf("B3"));
        assertEquals(CellValue.of(4), valueOf("B3"));
        assertEquals("=A2*2", textOf("B4"));
        assertEquals(CellValue.of(6), valueOf("B4"));
        assertEquals("", textOf("B5"));

        // edges were rebuilt for the new positions
        sheetService.setCell("A2", "10");
        assertEquals(CellValue.of(11), valueOf("B3"));
        assertEquals(CellValue.of(20), valueOf("B4"));
    }

    @Test
    void testDeletionShrinksOrInvalidatesRanges() {
        sheetService.setCell("C1", "SUM(A3:A5)");
        sheetService.setCell("D1", "SUM(A2:A2)");
        sheetService.setCell("E1", "MAX(B1:B2)");

        sheetService.deleteRow(0);
        // C1..E1 were in the deleted row
        assertEquals("", textOf("C1"));

        sheetService.setCell("C1", "SUM(A3:A5)");
        sheetService.setCell("D1", "SUM(A2:A2)");
        sheetService.deleteRow(1);

        assertEquals("SUM(A2:A4)", textOf("C1"));
        assertEquals("SUM(#REF!)", textOf("D1"));
        assertEquals(REF, valueOf("D1"));
    }

    @Test
    void testDeleteColumnShrinksRange() {
        sheetService.setCell("A1", "1");
        sheetService.setCell("B1", "2");
        sheetService.setCell("C1", "3");
        sheetService.setCell("A2", "SUM(A1:C1)");

        sheetService.deleteColumn(1);

        assertEquals("SUM(A1:B1)", textOf("A2"));
        assertEquals(CellValue.of(4), valueOf("A2"));
    }

    /**
     * Deleting an empty column that nothing reads leaves every value in place without re-evaluating.
     */
    @Test
    void testDeleteUnrelatedColumnEvaluatesNothing() {
        List<Long> sleeps = Collections.synchronizedList(new ArrayList<>());
        SheetService service = new SheetService(10, 10, new FormulaEvaluator(sleeps::add));
        service.setCell("A1", "=SLEEP(1)+B1+C1");
        service.setCell("B1", "1");
        service.setCell("C1", "1");
        sleeps.clear();

        service.deleteColumn(9);
        service.deleteRow(5);

        assertTrue(sleeps.isEmpty());
        assertEquals(CellValue.of(3), service.getCell("A1").getValue());
    }

    @Test
    void testDeleteColumnEvaluatesRewrittenFormulaOnce() {
        List<Long> sleeps = Collections.synchronizedList(new ArrayList<>());
        SheetService service = new SheetService(10, 10, new FormulaEvaluator(sleeps::add));
        service.setCell("A1", "=SLEEP(1)+B1+C1");
        service.setCell("B1", "1");
        service.setCell("C1", "2");
        service.setCell("A2", "=SLEEP(1)+D1");
        service.setCell("D1", "5");
        sleeps.clear();

        service.deleteColumn(1);

        // A1 lost its B1 input; A2 now reads the shifted D1 at C1
        assertEquals(2, sleeps.size());
        assertEquals(REF, service.getCell("A1").getValue());
        assertEquals("=SLEEP(1)+C1", service.getCell("A2").getText());
        assertEquals(CellValue.of(6), service.getCell("A2").getValue());
        assertEquals(CellValue.of(5), service.getCell("C1").getValue());
    }

    @Test
    void testDeleteOutOfBounds() {
        assertThrows(SheetBoundsException.class, () -> sheetService.deleteRow(10));
        assertThrows(SheetBoundsException.class, () -> sheetService.deleteRow(-1));
        assertThrows(SheetBoundsException.class, () -> sheetService.deleteColumn(10));
    }

    // ----------------------------------------------------------------
    // Copy / cut / paste
    // ----------------------------------------------------------------

    @Test
    void testPasteTranslatesReferences() {
        sheetService.setCell("A1", "1");
        sheetService.setCell("A2", "2");
        sheetService.setCell("B1", "=A1*10");
        sheetService.setCell("B2", "=A2*10");

        Clipboard clipboard = sheetService.copy(CellRange.parse("A1:B2"));
        assertFalse(clipboard.isCut());
        PasteReport report = sheetService.paste(clipboard, Address.parse("C3"));

        assertTrue(report.isComplete());
        assertEquals(4, report.getPasted().size());
        assertEquals("1", textOf("C3"));
        assertEquals("=C3*10", textOf("D3"));
        assertEquals(CellValue.of(10), valueOf("D3"));
        assertEquals("=C4*10", textOf("D4"));
        assertEquals(CellValue.of(20), valueOf("D4"));
        // source untouched
        assertEquals("=A1*10", textOf("B1"));
    }

    @Test
    void testPasteTranslatedOffSheetBecomesRefError() {
        sheetService.setCell("B2", "=A1+1");
        PasteReport report = sheetService.paste(sheetService.copy(CellRange.parse("B2:B2")), Address.parse("A1"));

        assertTrue(report.isComplete());
        assertEquals("=#REF!+1", textOf("A1"));
        assertEquals(REF, valueOf("A1"));
    }

    @Test
    void testPastePartlyOutsideSheet() {
        sheetService.setCell("A1", "1");
        sheetService.setCell("B1", "2");
        sheetService.setCell("A2", "3");
        sheetService.setCell("B2", "4");

        PasteReport report = sheetService.paste(sheetService.copy(CellRange.parse("A1:B2")), Address.parse("J10"));

        assertEquals(Collections.singletonList(Address.parse("J10")), report.getPasted());
        assertEquals(3, report.getRejections().size());
        assertFalse(report.isComplete());
        assertEquals(CellValue.of(1), valueOf("J10"));
    }

    /**
     * A cell whose pasted formula closes a cycle is reported; its neighbours still commit.
     */
    @Test
    void testPasteReportsCycleAndContinues() {
        sheetService.setCell("B1", "=C2");
        sheetService.setCell("C4", "=B3");
        sheetService.setCell("D4", "7");

        PasteReport report = sheetService.paste(sheetService.copy(CellRange.parse("C4:D4")), Address.parse("C2"));

        assertEquals(1, report.getRejections().size());
        assertEquals(Address.parse("C2"), report.getRejections().get(0).getAddress());
        assertEquals(Collections.singletonList(Address.parse("D2")), report.getPasted());
        assertEquals("", textOf("C2"));
        assertEquals(CellValue.of(7), valueOf("D2"));
    }

    @Test
    void testPasteAnchorOutsideSheet() {
        Clipboard clipboard = sheetService.copy(CellRange.parse("A1:A1"));
        assertThrows(SheetBoundsException.class, () -> sheetService.paste(clipboard, new Address(10, 10)));
        assertThrows(SheetBoundsException.class, () -> sheetService.copy(CellRange.parse("A1:K1")));
    }

    /**
     * Readers of a cut cell see an empty cell; they do not follow the pasted content.
     */
    @Test
    void testCutAndPaste() {
        sheetService.setCell("A1", "5");
        sheetService.setCell("B1", "=A1");
        sheetService.setCell("C1", "=A1*2");

        Clipboard clipboard = sheetService.cut(CellRange.parse("A1:A1"));
        assertTrue(clipboard.isCut());
        assertEquals("", textOf("A1"));
        assertEquals(CellValue.ZERO, valueOf("B1"));
        assertEquals(CellValue.ZERO, valueOf("C1"));

        sheetService.paste(clipboard, Address.parse("A3"));
        assertEquals(CellValue.of(5), valueOf("A3"));
        assertEquals("=A1", textOf("B1"));
        assertEquals(CellValue.ZERO, valueOf("B1"));
    }

    @Test
    void testCutFormulaRemovesItsEdges() {
        sheetService.setCell("B1", "=A1+1");
        Clipboard clipboard = sheetService.cut(CellRange.parse("B1:B1"));
        assertTrue(sheetService.getForwardDependencies().isEmpty());

        sheetService.paste(clipboard, Address.parse("B5"));
        assertEquals("=A5+1", textOf("B5"));
        assertEquals(CellValue.of(1), valueOf("B5"));
    }

    // ----------------------------------------------------------------
    // Sort
    // ----------------------------------------------------------------

    /**
     * [3, =1+1, 1] sorts to literals [1, 2, 3].
     */
    @Test
    void testSortClearsFormulas() {
        sheetService.setCell("A1", "3");
        sheetService.setCell("A2", "=1+1");
        sheetService.setCell("A3", "1");

        sheetService.sort(CellRange.parse("A1:A3"), true, SortDimension.COLUMNS);

        assertEquals("1", textOf("A1"));
        assertEquals("2", textOf("A2"));
        assertEquals("3", textOf("A3"));
        for (String cell : new String[]{"A1", "A2", "A3"}) {
            assertFalse(sheetService.getCell(cell).isFormula());
        }
    }

    @Test
    void testSortDescendingPutsErrorsLast() {
        sheetService.setCell("A1", "1/0");
        sheetService.setCell("A2", "5");
        sheetService.setCell("A3", "7");

        sheetService.sort(CellRange.parse("A1:A3"), false, SortDimension.COLUMNS);

        assertEquals(CellValue.of(7), valueOf("A1"));
        assertEquals(CellValue.of(5), valueOf("A2"));
        assertEquals("#DIV/0!", textOf("A3"));
        assertEquals(CellValue.error(ErrorKind.DIVISION_BY_ZERO), valueOf("A3"));
    }

    @Test
    void testSortEachColumn() {
        sheetService.setCell("A1", "4");
        sheetService.setCell("B1", "1");
        sheetService.setCell("A2", "2");
        sheetService.setCell("B2", "3");

        sheetService.sort(CellRange.parse("A1:B2"), true, SortDimension.COLUMNS);

        assertEquals(CellValue.of(2), valueOf("A1"));
        assertEquals(CellValue.of(4), valueOf("A2"));
        assertEquals(CellValue.of(1), valueOf("B1"));
        assertEquals(CellValue.of(3), valueOf("B2"));
    }

    @Test
    void testSortEachRow() {
        sheetService.setCell("A1", "3");
        sheetService.setCell("B1", "1");
        sheetService.setCell("C1", "2");
        sheetService.setCell("A2", "9");
        sheetService.setCell("B2", "8");
        sheetService.setCell("C2", "7");

        sheetService.sort(CellRange.parse("A1:C2"), true, SortDimension.ROWS);

        assertEquals("1", textOf("A1"));
        assertEquals("2", textOf("B1"));
        assertEquals("3", textOf("C1"));
        assertEquals("7", textOf("A2"));
        assertEquals("8", textOf("B2"));
        assertEquals("9", textOf("C2"));
    }

    @Test
    void testSortWholeRangeRowMajor() {
        sheetService.setCell("A1", "4");
        sheetService.setCell("B1", "3");
        sheetService.setCell("A2", "2");
        sheetService.setCell("B2", "1");

        sheetService.sort(CellRange.parse("A1:B2"), true, SortDimension.WHOLE_RANGE);

        assertEquals(CellValue.of(1), valueOf("A1"));
        assertEquals(CellValue.of(2), valueOf("B1"));
        assertEquals(CellValue.of(3), valueOf("A2"));
        assertEquals(CellValue.of(4), valueOf("B2"));
    }

    /**
     * Empty cells sort as zero; readers outside the range recalculate.
     */
    @Test
    void testSortUpdatesReadersOutsideRange() {
        sheetService.setCell("A1", "5");
        sheetService.setCell("A3", "-2");
        sheetService.setCell("D1", "=A1");
        sheetService.setCell("D2", "SUM(A1:A3)");

        sheetService.sort(CellRange.parse("A1:A3"), true, SortDimension.COLUMNS);

        assertEquals("-2", textOf("A1"));
        assertEquals("0", textOf("A2"));
        assertEquals("5", textOf("A3"));
        assertEquals(CellValue.of(-2), valueOf("D1"));
        assertEquals(CellValue.of(3), valueOf("D2"));
    }

    @Test
    void testSortOutOfBounds() {
        assertThrows(SheetBoundsException.class,
                () -> sheetService.sort(CellRange.parse("A1:A11"), true, SortDimension.COLUMNS));
    }
}
