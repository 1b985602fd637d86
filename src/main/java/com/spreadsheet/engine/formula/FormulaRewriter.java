package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.ErrorKind;
import com.spreadsheet.engine.models.Reference;

import java.util.function.Function;

/**
 * Rewrites the references inside formula text, leaving every other character as typed.
 */
public final class FormulaRewriter {

    private FormulaRewriter() {
    }

    /**
     * Replaces each reference with {@code mapping.apply(reference)}. A null mapping result
     * writes the {@code #REF!} marker in place of the reference.
     */
    public static String rewrite(ParsedFormula formula, Function<Reference, Reference> mapping) {
        String text = formula.getText();
        if (formula.getSpans().isEmpty()) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        int last = 0;
        for (ReferenceSpan span : formula.getSpans()) {
            out.append(text, last, span.getStart());
            Reference mapped = mapping.apply(span.getReference());
            out.append(mapped == null ? ErrorKind.INVALID_REFERENCE.getCode() : mapped.toString());
            last = span.getEnd();
        }
        out.append(text.substring(last));
        return out.toString();
    }
}
