package com.spreadsheet.engine.models;

import com.spreadsheet.engine.formula.ParsedFormula;

/**
 * Represents a single spreadsheet cell.
 * Stores:
 * - its position in the grid
 * - text (blank, a literal number, or a formula) and its parsed form
 * - value (the last computed result, a number or an error)
 * Only the commit protocol writes to a cell.
 */
public class Cell {
    private final Address address;
    private String text = "";
    private ParsedFormula formula;
    private CellValue value = CellValue.ZERO;

    public Cell(Address address) {
        this.address = address;
    }

    public Address getAddress() {
        return address;
    }

    public String getText() {
        return text;
    }

    /**
     * Parsed form of {@link #getText()}, or null for a cell that was never written.
     */
    public ParsedFormula getFormula() {
        return formula;
    }

    // Text and parsed form always change together
    public void setContent(String text, ParsedFormula formula) {
        this.text = text;
        this.formula = formula;
    }

    public CellValue getValue() {
        return value;
    }

    public void setValue(CellValue value) {
        this.value = value;
    }

    public boolean isEmpty() {
        return formula == null || formula.isBlank();
    }

    public boolean isFormula() {
        return formula != null && formula.isFormula();
    }

    public void reset() {
        text = "";
        formula = null;
        value = CellValue.ZERO;
    }
}
