package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.Reference;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Result of parsing a cell's text: the expression tree (null for blank text),
 * the references it reads, and the source positions of those references.
 */
public final class ParsedFormula {

    private final String text;
    private final Expr expression;
    private final List<ReferenceSpan> spans;
    private final Set<Reference> references;

    ParsedFormula(String text, Expr expression, List<ReferenceSpan> spans) {
        this.text = text;
        this.expression = expression;
        this.spans = Collections.unmodifiableList(spans);
        Set<Reference> refs = new LinkedHashSet<>();
        for (ReferenceSpan span : spans) {
            refs.add(span.getReference());
        }
        this.references = Collections.unmodifiableSet(refs);
    }

    static ParsedFormula blank(String text) {
        return new ParsedFormula(text, null, Collections.emptyList());
    }

    public String getText() {
        return text;
    }

    public Expr getExpression() {
        return expression;
    }

    public boolean isBlank() {
        return expression == null;
    }

    /**
     * True unless the text is blank or a bare number/error literal.
     */
    public boolean isFormula() {
        return expression != null && !(expression instanceof Expr.Literal);
    }

    public List<ReferenceSpan> getSpans() {
        return spans;
    }

    /**
     * Distinct references in order of first appearance.
     */
    public Set<Reference> getReferences() {
        return references;
    }
}
