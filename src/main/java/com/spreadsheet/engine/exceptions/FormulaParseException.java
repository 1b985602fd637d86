package com.spreadsheet.engine.exceptions;

/**
 * Thrown when cell text is not a valid number or formula,
 * for example an unknown function, an unbalanced parenthesis,
 * or a reference to a cell outside the sheet.
 */
public class FormulaParseException extends RuntimeException {
    public FormulaParseException(String message) {
        super(message);
    }
}
