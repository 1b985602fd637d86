package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.Address;
import com.spreadsheet.engine.models.CellValue;
import com.spreadsheet.engine.models.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Evaluates expression trees against the current cell values.
 * Never throws for value-level problems: division by zero, references to cells
 * holding errors and short STDEV samples all come back as error values.
 */
public class FormulaEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(FormulaEvaluator.class);

    private final Sleeper sleeper;

    public FormulaEvaluator() {
        this(FormulaEvaluator::sleepSeconds);
    }

    public FormulaEvaluator(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    /**
     * Value of a parsed cell; blank cells evaluate to zero.
     */
    public CellValue evaluate(ParsedFormula formula, ValueLookup lookup) {
        if (formula.isBlank()) {
            return CellValue.ZERO;
        }
        return evaluate(formula.getExpression(), lookup);
    }

    public CellValue evaluate(Expr expr, ValueLookup lookup) {
        if (expr instanceof Expr.Literal) {
            return ((Expr.Literal) expr).getValue();
        }
        if (expr instanceof Expr.Ref) {
            Expr.Ref ref = (Expr.Ref) expr;
            if (!ref.getReference().isSingle()) {
                throw new IllegalArgumentException("Range " + ref + " used outside an aggregate");
            }
            return lookup.valueAt(ref.getReference().getAddress());
        }
        if (expr instanceof Expr.BinaryOp) {
            return evaluateBinary((Expr.BinaryOp) expr, lookup);
        }
        if (expr instanceof Expr.AggregateCall) {
            return evaluateAggregate((Expr.AggregateCall) expr, lookup);
        }
        if (expr instanceof Expr.SleepCall) {
            CellValue duration = evaluate(((Expr.SleepCall) expr).getDuration(), lookup);
            if (duration.isError()) {
                return duration;
            }
            sleeper.sleep(Math.max(0L, duration.getNumber()));
            return duration;
        }
        throw new IllegalArgumentException("Unsupported expression node: " + expr.getClass().getName());
    }

    private CellValue evaluateBinary(Expr.BinaryOp op, ValueLookup lookup) {
        CellValue left = evaluate(op.getLeft(), lookup);
        if (left.isError()) {
            return left;
        }
        CellValue right = evaluate(op.getRight(), lookup);
        if (right.isError()) {
            return right;
        }
        long a = left.getNumber();
        long b = right.getNumber();
        switch (op.getOperator()) {
            case '+':
                return CellValue.of(a + b);
            case '-':
                return CellValue.of(a - b);
            case '*':
                return CellValue.of(a * b);
            case '/':
                if (b == 0) {
                    return CellValue.error(ErrorKind.DIVISION_BY_ZERO);
                }
                return CellValue.of(a / b);
            default:
                throw new IllegalArgumentException("Unsupported operator " + op.getOperator());
        }
    }

    private CellValue evaluateAggregate(Expr.AggregateCall call, ValueLookup lookup) {
        Expr argument = call.getArgument();
        if (argument instanceof Expr.Literal) {
            return ((Expr.Literal) argument).getValue();
        }
        List<Address> cells = ((Expr.Ref) argument).getReference().getRange().cells();
        long[] values = new long[cells.size()];
        for (int i = 0; i < values.length; i++) {
            CellValue v = lookup.valueAt(cells.get(i));
            if (v.isError()) {
                // first error in row-major order wins
                return v;
            }
            values[i] = v.getNumber();
        }
        return call.getFunction().apply(values);
    }

    private static void sleepSeconds(long seconds) {
        try {
            TimeUnit.SECONDS.sleep(seconds);
        } catch (InterruptedException e) {
            logger.warn("SLEEP({}) interrupted", seconds);
            Thread.currentThread().interrupt();
        }
    }
}
