package com.spreadsheet.engine.models;

/**
 * Cell texts copied from a range, anchored at the range's top-left corner.
 * Holds what was typed, not computed values. Owned by the editing session, not the sheet.
 */
public final class Clipboard {
    private final CellRange source;
    private final String[][] texts;
    private final boolean cut;

    public Clipboard(CellRange source, String[][] texts, boolean cut) {
        this.source = source;
        this.texts = new String[texts.length][];
        for (int r = 0; r < texts.length; r++) {
            this.texts[r] = texts[r].clone();
        }
        this.cut = cut;
    }

    public CellRange getSource() {
        return source;
    }

    public Address getAnchor() {
        return source.getTopLeft();
    }

    public int getRowCount() {
        return source.getRowCount();
    }

    public int getColumnCount() {
        return source.getColumnCount();
    }

    /**
     * Text at an offset from the anchor.
     */
    public String getText(int rowOffset, int columnOffset) {
        return texts[rowOffset][columnOffset];
    }

    public boolean isCut() {
        return cut;
    }
}
