package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.exceptions.FormulaParseException;
import com.spreadsheet.engine.models.Address;
import com.spreadsheet.engine.models.CellValue;
import com.spreadsheet.engine.models.ErrorKind;
import com.spreadsheet.engine.models.Reference;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for cell text.
 *
 * <pre>
 * formula   := ['='] expr
 * expr      := term (('+' | '-') term)*
 * term      := unary (('*' | '/') unary)*
 * unary     := '-' unary | primary
 * primary   := NUMBER | ERROR | CELL | '(' expr ')'
 *            | AGGREGATE '(' (CELL ':' CELL | ERROR) ')'
 *            | 'SLEEP' '(' expr ')'
 * </pre>
 *
 * References are checked against the sheet's dimensions here, so an out-of-bounds
 * reference is a parse failure rather than a runtime error.
 */
public class FormulaParser {

    private final int rows;
    private final int columns;

    public FormulaParser(int rows, int columns) {
        this.rows = rows;
        this.columns = columns;
    }

    /**
     * Parses raw cell text. Blank text yields a blank formula (an empty cell).
     *
     * @throws FormulaParseException if the text is not a number or a valid formula
     */
    public ParsedFormula parse(String text) {
        String raw = text == null ? "" : text;
        if (raw.trim().isEmpty()) {
            return ParsedFormula.blank(raw);
        }
        return new Parser(raw).parseFormula();
    }

    enum TokType {
        NUMBER, CELL, NAME, ERROR,
        PLUS, MINUS, STAR, SLASH,
        LPAREN, RPAREN, COLON, EQUALS,
        EOF
    }

    static final class Token {
        final TokType type;
        final String text;
        final int start;
        final int end;

        Token(TokType type, String text, int start, int end) {
            this.type = type;
            this.text = text;
            this.start = start;
            this.end = end;
        }

        @Override
        public String toString() {
            return type == TokType.EOF ? "end of formula" : "'" + text + "'";
        }
    }

    static final class Lexer {
        private final String s;
        private int i = 0;

        Lexer(String s) {
            this.s = s;
        }

        Token next() {
            while (i < s.length() && Character.isWhitespace(s.charAt(i))) {
                i++;
            }
            if (i >= s.length()) {
                return new Token(TokType.EOF, "", i, i);
            }
            int start = i;
            char c = s.charAt(i);
            if (Character.isLetter(c)) {
                while (i < s.length() && Character.isLetter(s.charAt(i))) {
                    i++;
                }
                if (i < s.length() && Character.isDigit(s.charAt(i))) {
                    while (i < s.length() && Character.isDigit(s.charAt(i))) {
                        i++;
                    }
                    return new Token(TokType.CELL, s.substring(start, i), start, i);
                }
                return new Token(TokType.NAME, s.substring(start, i), start, i);
            }
            if (Character.isDigit(c)) {
                while (i < s.length() && Character.isDigit(s.charAt(i))) {
                    i++;
                }
                if (i < s.length() && s.charAt(i) == '.') {
                    throw new FormulaParseException("Only integer numbers are supported: '" + s + "'");
                }
                return new Token(TokType.NUMBER, s.substring(start, i), start, i);
            }
            if (c == '#') {
                i++;
                while (i < s.length() && (Character.isLetterOrDigit(s.charAt(i)) || s.charAt(i) == '/')) {
                    i++;
                }
                if (i < s.length() && s.charAt(i) == '!') {
                    i++;
                }
                String code = s.substring(start, i);
                if (ErrorKind.fromCode(code) == null) {
                    throw new FormulaParseException("Unknown error code " + code);
                }
                return new Token(TokType.ERROR, code, start, i);
            }
            i++;
            switch (c) {
                case '+': return new Token(TokType.PLUS, "+", start, i);
                case '-': return new Token(TokType.MINUS, "-", start, i);
                case '*': return new Token(TokType.STAR, "*", start, i);
                case '/': return new Token(TokType.SLASH, "/", start, i);
                case '(': return new Token(TokType.LPAREN, "(", start, i);
                case ')': return new Token(TokType.RPAREN, ")", start, i);
                case ':': return new Token(TokType.COLON, ":", start, i);
                case '=': return new Token(TokType.EQUALS, "=", start, i);
                default:
                    throw new FormulaParseException("Unexpected character '" + c + "' in '" + s + "'");
            }
        }
    }

    private final class Parser {
        private final String text;
        private final Lexer lexer;
        private final List<ReferenceSpan> spans = new ArrayList<>();
        private Token la;

        Parser(String text) {
            this.text = text;
            this.lexer = new Lexer(text);
            this.la = lexer.next();
        }

        ParsedFormula parseFormula() {
            if (look(TokType.EQUALS)) {
                eat(TokType.EQUALS);
            }
            if (look(TokType.EOF)) {
                throw new FormulaParseException("Empty formula: '" + text + "'");
            }
            Expr expr = parseExpr();
            if (!look(TokType.EOF)) {
                throw new FormulaParseException("Unexpected " + la + " in '" + text + "'");
            }
            return new ParsedFormula(text, expr, spans);
        }

        private Token eat(TokType type) {
            if (la.type != type) {
                throw new FormulaParseException("Expected " + type + " but found " + la + " in '" + text + "'");
            }
            Token current = la;
            la = lexer.next();
            return current;
        }

        private boolean look(TokType type) {
            return la.type == type;
        }

        private Expr parseExpr() {
            Expr left = parseTerm();
            while (true) {
                if (look(TokType.PLUS)) {
                    eat(TokType.PLUS);
                    left = new Expr.BinaryOp('+', left, parseTerm());
                } else if (look(TokType.MINUS)) {
                    eat(TokType.MINUS);
                    left = new Expr.BinaryOp('-', left, parseTerm());
                } else {
                    return left;
                }
            }
        }

        private Expr parseTerm() {
            Expr left = parseUnary();
            while (true) {
                if (look(TokType.STAR)) {
                    eat(TokType.STAR);
                    left = new Expr.BinaryOp('*', left, parseUnary());
                } else if (look(TokType.SLASH)) {
                    eat(TokType.SLASH);
                    left = new Expr.BinaryOp('/', left, parseUnary());
                } else {
                    return left;
                }
            }
        }

        private Expr parseUnary() {
            if (look(TokType.MINUS)) {
                eat(TokType.MINUS);
                Expr operand = parseUnary();
                if (operand instanceof Expr.Literal && !((Expr.Literal) operand).getValue().isError()) {
                    // keep "-5" a plain literal
                    return new Expr.Literal(CellValue.of(-((Expr.Literal) operand).getValue().getNumber()));
                }
                return new Expr.BinaryOp('-', new Expr.Literal(CellValue.ZERO), operand);
            }
            return parsePrimary();
        }

        private Expr parsePrimary() {
            switch (la.type) {
                case NUMBER: {
                    Token t = eat(TokType.NUMBER);
                    try {
                        return new Expr.Literal(CellValue.of(Long.parseLong(t.text)));
                    } catch (NumberFormatException e) {
                        throw new FormulaParseException("Number out of range: " + t.text);
                    }
                }
                case ERROR:
                    return new Expr.Literal(CellValue.error(ErrorKind.fromCode(eat(TokType.ERROR).text)));
                case CELL: {
                    Token t = eat(TokType.CELL);
                    if (look(TokType.COLON)) {
                        throw new FormulaParseException("Range " + t.text + ":... is only allowed as a function argument");
                    }
                    Reference ref = Reference.single(resolve(t));
                    spans.add(new ReferenceSpan(t.start, t.end, ref));
                    return new Expr.Ref(ref);
                }
                case NAME:
                    return parseCall(eat(TokType.NAME));
                case LPAREN: {
                    eat(TokType.LPAREN);
                    Expr inner = parseExpr();
                    eat(TokType.RPAREN);
                    return inner;
                }
                default:
                    throw new FormulaParseException("Unexpected " + la + " in '" + text + "'");
            }
        }

        private Expr parseCall(Token name) {
            if (!look(TokType.LPAREN)) {
                throw new FormulaParseException("Unknown name '" + name.text + "' in '" + text + "'");
            }
            AggregateFunction aggregate = AggregateFunction.fromName(name.text);
            if (aggregate != null) {
                eat(TokType.LPAREN);
                Expr argument = parseRangeArgument(aggregate);
                eat(TokType.RPAREN);
                return new Expr.AggregateCall(aggregate, argument);
            }
            if ("SLEEP".equalsIgnoreCase(name.text)) {
                eat(TokType.LPAREN);
                Expr duration = parseExpr();
                eat(TokType.RPAREN);
                return new Expr.SleepCall(duration);
            }
            throw new FormulaParseException("Unknown function " + name.text + " in '" + text + "'");
        }

        private Expr parseRangeArgument(AggregateFunction function) {
            if (look(TokType.ERROR)) {
                return new Expr.Literal(CellValue.error(ErrorKind.fromCode(eat(TokType.ERROR).text)));
            }
            if (!look(TokType.CELL)) {
                throw new FormulaParseException(function + " expects a range argument in '" + text + "'");
            }
            Token from = eat(TokType.CELL);
            if (!look(TokType.COLON)) {
                throw new FormulaParseException(function + " expects a range argument in '" + text + "'");
            }
            eat(TokType.COLON);
            Token to = eat(TokType.CELL);
            Address topLeft = resolve(from);
            Address bottomRight = resolve(to);
            if (topLeft.getRow() > bottomRight.getRow() || topLeft.getColumn() > bottomRight.getColumn()) {
                throw new FormulaParseException("Range " + from.text + ":" + to.text + " must go from top-left to bottom-right");
            }
            Reference ref = Reference.range(topLeft, bottomRight);
            spans.add(new ReferenceSpan(from.start, to.end, ref));
            return new Expr.Ref(ref);
        }

        private Address resolve(Token cell) {
            Address address = Address.parse(cell.text);
            if (!address.isWithin(rows, columns)) {
                throw new FormulaParseException("Reference " + cell.text + " is outside the sheet");
            }
            return address;
        }
    }
}
