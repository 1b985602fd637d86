package com.spreadsheet.engine.services;

import com.spreadsheet.engine.exceptions.InvalidRangeException;
import com.spreadsheet.engine.exceptions.SheetBoundsException;
import com.spreadsheet.engine.models.Address;
import com.spreadsheet.engine.models.CellRange;
import com.spreadsheet.engine.models.CellValue;
import com.spreadsheet.engine.models.CellView;
import com.spreadsheet.engine.util.PatternDetector;
import com.spreadsheet.engine.util.PatternDetector.SequencePattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Continues a number sequence into a one-row or one-column range.
 * The sequence is read from the cells just before the range: above it for a column,
 * to its left for a row.
 */
@Service
public class AutofillService {

    private static final Logger logger = LoggerFactory.getLogger(AutofillService.class);

    static final int MAX_SAMPLE = 5;

    private final SheetService sheetService;

    public AutofillService(SheetService sheetService) {
        this.sheetService = sheetService;
    }

    /**
     * Detects the pattern of up to {@value #MAX_SAMPLE} non-empty cells preceding {@code range}
     * and writes its continuation into the range as literals. Nothing is written for UNKNOWN.
     *
     * @throws InvalidRangeException if the range spans more than one row and more than one column,
     *                               or if a continued term does not fit in a long (nothing is written)
     * @throws SheetBoundsException  if the range leaves the sheet
     */
    public SequencePattern autofill(CellRange range) {
        if (range.getRowCount() > 1 && range.getColumnCount() > 1) {
            throw new InvalidRangeException("Autofill needs a single row or column, got " + range);
        }
        if (!range.isWithin(sheetService.getRows(), sheetService.getColumns())) {
            throw new SheetBoundsException("Range " + range + " is outside the sheet");
        }
        Address start = range.getTopLeft();
        // a single cell continues the column above it unless it sits in the first row
        boolean vertical = range.getRowCount() > 1 || (range.getColumnCount() == 1 && start.getRow() > 0);
        int rowStep = vertical ? -1 : 0;
        int columnStep = vertical ? 0 : -1;

        List<Long> sample = new ArrayList<>();
        Address cursor = start.offset(rowStep, columnStep);
        while (sample.size() < MAX_SAMPLE && cursor.getRow() >= 0 && cursor.getColumn() >= 0) {
            CellView view = sheetService.getCell(cursor);
            if (view.getText().trim().isEmpty()) {
                break;
            }
            CellValue value = view.getValue();
            if (value.isError()) {
                logger.info("Autofill {}: {} holds {}, no pattern", range, cursor, value);
                return SequencePattern.UNKNOWN;
            }
            sample.add(0, value.getNumber());
            cursor = cursor.offset(rowStep, columnStep);
        }

        long[] values = new long[sample.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = sample.get(i);
        }
        SequencePattern pattern = PatternDetector.detect(values);
        if (pattern == SequencePattern.UNKNOWN) {
            logger.info("Autofill {}: no pattern in {} preceding value(s)", range, values.length);
            return pattern;
        }

        List<Address> targets = range.cells();
        long[] filled;
        try {
            filled = PatternDetector.extend(values, pattern, targets.size());
        } catch (ArithmeticException ex) {
            logger.warn("Autofill {}: {} continuation overflows", range, pattern);
            throw new InvalidRangeException("Continuing the " + pattern + " pattern over " + range
                    + " does not fit in a long: " + ex.getMessage());
        }
        for (int i = 0; i < targets.size(); i++) {
            sheetService.setCell(targets.get(i), Long.toString(filled[i]));
        }
        logger.info("Autofill {} with {} pattern", range, pattern);
        return pattern;
    }
}
