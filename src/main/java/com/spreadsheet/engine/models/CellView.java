package com.spreadsheet.engine.models;

/**
 * Read-only snapshot of one cell: what was typed and what it evaluates to.
 */
public final class CellView {
    private final Address address;
    private final String text;
    private final CellValue value;
    private final boolean formula;

    public CellView(Address address, String text, CellValue value, boolean formula) {
        this.address = address;
        this.text = text;
        this.value = value;
        this.formula = formula;
    }

    public Address getAddress() {
        return address;
    }

    public String getText() {
        return text;
    }

    public CellValue getValue() {
        return value;
    }

    public boolean isError() {
        return value.isError();
    }

    public boolean isFormula() {
        return formula;
    }

    @Override
    public String toString() {
        return address + "=" + value + (formula ? " [" + text + "]" : "");
    }
}
