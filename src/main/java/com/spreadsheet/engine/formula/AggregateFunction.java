package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.CellValue;
import com.spreadsheet.engine.models.ErrorKind;

/**
 * Range functions. Each receives the numeric values of the range in row-major order;
 * error elements are handled by the evaluator before the function is applied.
 */
public enum AggregateFunction {
    SUM {
        @Override
        CellValue apply(long[] values) {
            long sum = 0;
            for (long v : values) {
                sum += v;
            }
            return CellValue.of(sum);
        }
    },
    AVG {
        @Override
        CellValue apply(long[] values) {
            long sum = 0;
            for (long v : values) {
                sum += v;
            }
            return CellValue.of(sum / values.length);
        }
    },
    MIN {
        @Override
        CellValue apply(long[] values) {
            long min = Long.MAX_VALUE;
            for (long v : values) {
                min = Math.min(min, v);
            }
            return CellValue.of(min);
        }
    },
    MAX {
        @Override
        CellValue apply(long[] values) {
            long max = Long.MIN_VALUE;
            for (long v : values) {
                max = Math.max(max, v);
            }
            return CellValue.of(max);
        }
    },
    STDEV {
        // Population standard deviation, truncated toward zero.
        @Override
        CellValue apply(long[] values) {
            if (values.length < 2) {
                return CellValue.error(ErrorKind.INSUFFICIENT_SAMPLE);
            }
            double mean = 0;
            for (long v : values) {
                mean += v;
            }
            mean /= values.length;
            double squares = 0;
            for (long v : values) {
                double diff = v - mean;
                squares += diff * diff;
            }
            return CellValue.of((long) Math.sqrt(squares / values.length));
        }
    };

    abstract CellValue apply(long[] values);

    /**
     * Case-insensitive lookup by function name, or null for anything else.
     */
    public static AggregateFunction fromName(String name) {
        for (AggregateFunction f : values()) {
            if (f.name().equalsIgnoreCase(name)) {
                return f;
            }
        }
        return null;
    }
}
