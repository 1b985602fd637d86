package com.spreadsheet.engine.exceptions;

/**
 * Thrown when an address, range, row or column index
 * falls outside the sheet's fixed dimensions.
 */
public class SheetBoundsException extends RuntimeException {
    public SheetBoundsException(String message) {
        super(message);
    }
}
