package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.Address;
import com.spreadsheet.engine.models.CellValue;

/**
 * Read access to the current value of a cell during evaluation.
 */
@FunctionalInterface
public interface ValueLookup {
    CellValue valueAt(Address address);
}
