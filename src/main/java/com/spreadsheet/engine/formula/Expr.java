package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.CellValue;
import com.spreadsheet.engine.models.Reference;

/**
 * Parsed formula tree. The set of node types is closed; {@link FormulaEvaluator}
 * dispatches on them structurally.
 */
public abstract class Expr {

    private Expr() {
    }

    /**
     * A number or an error code written directly in the formula.
     */
    public static final class Literal extends Expr {
        private final CellValue value;

        public Literal(CellValue value) {
            this.value = value;
        }

        public CellValue getValue() {
            return value;
        }

        @Override
        public String toString() {
            return value.toLiteral();
        }
    }

    /**
     * A cell reference, or a range when it appears as an aggregate argument.
     */
    public static final class Ref extends Expr {
        private final Reference reference;

        public Ref(Reference reference) {
            this.reference = reference;
        }

        public Reference getReference() {
            return reference;
        }

        @Override
        public String toString() {
            return reference.toString();
        }
    }

    public static final class BinaryOp extends Expr {
        private final char operator;
        private final Expr left;
        private final Expr right;

        public BinaryOp(char operator, Expr left, Expr right) {
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        public char getOperator() {
            return operator;
        }

        public Expr getLeft() {
            return left;
        }

        public Expr getRight() {
            return right;
        }

        @Override
        public String toString() {
            return "(" + left + " " + operator + " " + right + ")";
        }
    }

    /**
     * SUM/AVG/MIN/MAX/STDEV over a range. The argument is a range {@link Ref},
     * or an error {@link Literal} left behind by a structural rewrite.
     */
    public static final class AggregateCall extends Expr {
        private final AggregateFunction function;
        private final Expr argument;

        public AggregateCall(AggregateFunction function, Expr argument) {
            this.function = function;
            this.argument = argument;
        }

        public AggregateFunction getFunction() {
            return function;
        }

        public Expr getArgument() {
            return argument;
        }

        @Override
        public String toString() {
            return function.name() + "(" + argument + ")";
        }
    }

    public static final class SleepCall extends Expr {
        private final Expr duration;

        public SleepCall(Expr duration) {
            this.duration = duration;
        }

        public Expr getDuration() {
            return duration;
        }

        @Override
        public String toString() {
            return "SLEEP(" + duration + ")";
        }
    }
}
