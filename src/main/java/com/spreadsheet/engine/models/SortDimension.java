package com.spreadsheet.engine.models;

/**
 * How a range is sorted.
 */
public enum SortDimension {
    /** Each column of the range independently, top to bottom. */
    COLUMNS,
    /** Each row of the range independently, left to right. */
    ROWS,
    /** All values of the range together, laid back out row-major. */
    WHOLE_RANGE
}
