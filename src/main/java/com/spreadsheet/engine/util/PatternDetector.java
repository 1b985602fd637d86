package com.spreadsheet.engine.util;

/**
 * Recognizes simple integer sequences and continues them.
 */
public final class PatternDetector {

    public enum SequencePattern {
        CONSTANT, ARITHMETIC, GEOMETRIC, FIBONACCI, FACTORIAL, TRIANGULAR, UNKNOWN
    }

    // 20! is the largest factorial that fits in a long
    private static final int MAX_FACTORIAL = 20;
    // T(k) for this k is about 4.5e18; k * (k + 1) stays inside a long a few steps past it
    private static final long MAX_TRIANGULAR_INDEX = 3_000_000_000L;

    private PatternDetector() {
    }

    /**
     * Classifies {@code values}, trying patterns in declaration order. Fewer than two values is UNKNOWN.
     */
    public static SequencePattern detect(long[] values) {
        if (values.length < 2) {
            return SequencePattern.UNKNOWN;
        }
        if (isConstant(values)) {
            return SequencePattern.CONSTANT;
        }
        if (isArithmetic(values)) {
            return SequencePattern.ARITHMETIC;
        }
        if (isGeometric(values)) {
            return SequencePattern.GEOMETRIC;
        }
        if (isFibonacci(values)) {
            return SequencePattern.FIBONACCI;
        }
        if (factorialStart(values) >= 0) {
            return SequencePattern.FACTORIAL;
        }
        if (triangularStart(values) >= 0) {
            return SequencePattern.TRIANGULAR;
        }
        return SequencePattern.UNKNOWN;
    }

    /**
     * The next {@code count} terms after {@code values} under {@code pattern}.
     * UNKNOWN yields an empty array.
     *
     * @throws ArithmeticException if a term does not fit in a long
     */
    public static long[] extend(long[] values, SequencePattern pattern, int count) {
        if (pattern == SequencePattern.UNKNOWN || values.length == 0) {
            return new long[0];
        }
        long[] out = new long[count];
        int n = values.length;
        long last = values[n - 1];
        switch (pattern) {
            case CONSTANT:
                for (int i = 0; i < count; i++) {
                    out[i] = last;
                }
                break;
            case ARITHMETIC: {
                long step = values[1] - values[0];
                for (int i = 0; i < count; i++) {
                    last = Math.addExact(last, step);
                    out[i] = last;
                }
                break;
            }
            case GEOMETRIC: {
                boolean growing = values[1] % values[0] == 0 && Math.abs(values[1]) >= Math.abs(values[0]);
                long factor = growing ? values[1] / values[0] : values[0] / values[1];
                for (int i = 0; i < count; i++) {
                    last = growing ? Math.multiplyExact(last, factor) : last / factor;
                    out[i] = last;
                }
                break;
            }
            case FIBONACCI: {
                long previous = values[n - 2];
                for (int i = 0; i < count; i++) {
                    long next = Math.addExact(previous, last);
                    previous = last;
                    last = next;
                    out[i] = next;
                }
                break;
            }
            case FACTORIAL: {
                int k = factorialStart(values) + n;
                for (int i = 0; i < count; i++) {
                    out[i] = factorial(k + i);
                }
                break;
            }
            case TRIANGULAR: {
                long k = triangularStart(values) + n;
                for (int i = 0; i < count; i++) {
                    out[i] = triangular(k + i);
                }
                break;
            }
            default:
                throw new IllegalArgumentException("Unsupported pattern " + pattern);
        }
        return out;
    }

    public static long factorial(int k) {
        if (k < 0 || k > MAX_FACTORIAL) {
            throw new ArithmeticException("factorial(" + k + ") does not fit in a long");
        }
        long result = 1;
        for (int i = 2; i <= k; i++) {
            result *= i;
        }
        return result;
    }

    public static long triangular(long k) {
        return Math.multiplyExact(k, k + 1) / 2;
    }

    private static boolean isConstant(long[] values) {
        for (int i = 1; i < values.length; i++) {
            if (values[i] != values[0]) {
                return false;
            }
        }
        return true;
    }

    private static boolean isArithmetic(long[] values) {
        long step = values[1] - values[0];
        for (int i = 2; i < values.length; i++) {
            if (values[i] - values[i - 1] != step) {
                return false;
            }
        }
        return true;
    }

    // Integer ratio in either direction: 2,4,8 (x2) or 81,27,9 (/3)
    private static boolean isGeometric(long[] values) {
        for (long v : values) {
            if (v == 0) {
                return false;
            }
        }
        long a = values[0];
        long b = values[1];
        boolean growing = b % a == 0 && Math.abs(b) >= Math.abs(a);
        boolean shrinking = a % b == 0 && Math.abs(a) > Math.abs(b);
        if (!growing && !shrinking) {
            return false;
        }
        long factor = growing ? b / a : a / b;
        if (factor == 1 || factor == -1) {
            return false;
        }
        for (int i = 1; i < values.length; i++) {
            long expected = growing ? values[i - 1] * factor : values[i - 1] / factor;
            if (!growing && values[i - 1] % factor != 0) {
                return false;
            }
            if (values[i] != expected) {
                return false;
            }
        }
        return true;
    }

    private static boolean isFibonacci(long[] values) {
        if (values.length < 3) {
            return false;
        }
        for (int i = 2; i < values.length; i++) {
            if (values[i] != values[i - 1] + values[i - 2]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Smallest k with values[i] == (k+i)! for every i, or -1.
     */
    private static int factorialStart(long[] values) {
        for (int k = 0; k + values.length - 1 <= MAX_FACTORIAL; k++) {
            boolean matches = true;
            for (int i = 0; i < values.length && matches; i++) {
                matches = values[i] == factorial(k + i);
            }
            if (matches) {
                return k;
            }
        }
        return -1;
    }

    /**
     * k with values[i] == T(k+i) for every i, or -1.
     */
    private static long triangularStart(long[] values) {
        if (values[0] < 0 || values[0] > triangular(MAX_TRIANGULAR_INDEX)) {
            return -1;
        }
        long k = (long) Math.floor((Math.sqrt(8.0 * values[0] + 1) - 1) / 2);
        // correct for floating point on large values
        while (triangular(k) > values[0]) {
            k--;
        }
        while (triangular(k + 1) <= values[0]) {
            k++;
        }
        if (triangular(k) != values[0]) {
            return -1;
        }
        for (int i = 1; i < values.length; i++) {
            if (values[i] != triangular(k + i)) {
                return -1;
            }
        }
        return k;
    }
}
