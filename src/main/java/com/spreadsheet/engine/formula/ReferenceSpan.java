package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.Reference;

/**
 * Where a reference sits in the source text: characters [start, end).
 * Used to rewrite references without touching the rest of the formula.
 */
public final class ReferenceSpan {

    private final int start;
    private final int end;
    private final Reference reference;

    public ReferenceSpan(int start, int end, Reference reference) {
        this.start = start;
        this.end = end;
        this.reference = reference;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public Reference getReference() {
        return reference;
    }
}
