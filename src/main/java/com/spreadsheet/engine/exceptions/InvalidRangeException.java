package com.spreadsheet.engine.exceptions;

/**
 * Thrown when a range has a shape the operation cannot work with,
 * e.g. corners given bottom-right first, or a 2-D range passed to autofill.
 */
public class InvalidRangeException extends RuntimeException {
    public InvalidRangeException(String message) {
        super(message);
    }
}
