package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.Address;
import com.spreadsheet.engine.models.Reference;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FormulaRewriterTest {

    private final FormulaParser parser = new FormulaParser(10, 10);

    @Test
    void testUnchangedWithIdentity() {
        String text = "=A1 +  sum(B1:C2) * 2";
        assertEquals(text, FormulaRewriter.rewrite(parser.parse(text), ref -> ref));
        // references are written back in canonical upper case
        assertEquals("=A1+B2", FormulaRewriter.rewrite(parser.parse("=a1+b2"), ref -> ref));
    }

    @Test
    void testShiftKeepsSurroundingText() {
        ParsedFormula parsed = parser.parse("=A1 + SUM(B1:C2)*2");
        String rewritten = FormulaRewriter.rewrite(parsed,
                ref -> ref.isSingle()
                        ? Reference.single(ref.getAddress().offset(1, 1))
                        : Reference.range(ref.getRange().getTopLeft().offset(1, 0), ref.getRange().getBottomRight().offset(1, 0)));
        assertEquals("=B2 + SUM(B2:C3)*2", rewritten);
    }

    /**
     * A reference that maps to nothing becomes the #REF! literal, which still parses.
     */
    @Test
    void testDroppedReferenceBecomesRefError() {
        ParsedFormula parsed = parser.parse("=A1+B1");
        Address a1 = Address.parse("A1");
        String rewritten = FormulaRewriter.rewrite(parsed, ref -> ref.covers(a1) ? null : ref);
        assertEquals("=#REF!+B1", rewritten);
        assertFalse(parser.parse(rewritten).getReferences().contains(Reference.single(a1)));
    }

    @Test
    void testLiteralTextUntouched() {
        assertEquals("42", FormulaRewriter.rewrite(parser.parse("42"), ref -> null));
        assertEquals("", FormulaRewriter.rewrite(parser.parse(""), ref -> null));
    }
}
