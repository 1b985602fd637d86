package com.spreadsheet.engine.exceptions;

/**
 * Thrown when committing a formula would make a cell reachable from itself
 * through the cells it reads (e.g., a cell referencing itself,
 * or a multi-cell loop). The sheet is left exactly as it was.
 */
public class CircularReferenceException extends RuntimeException {
    public CircularReferenceException(String message) {
        super(message);
    }
}
