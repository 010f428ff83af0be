package io.mathxform.core.algebra;

import io.mathxform.core.error.ExpressionSyntaxException;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the infix syntax of rule files ({@code a*x**2 + b*x + c}).
 *
 * <p>
 * The result is <em>not</em> normalized: {@code a + a} stays a two-term sum and {@code a - b}
 * becomes {@code a + (-1)*b}. Operators are {@code + - * /}, {@code **} or {@code ^} (right
 * associative), unary minus and parentheses. {@code I} is the imaginary unit, {@code sqrt(u)} is
 * {@code u**(1/2)}, and function names go through {@link Functions#canonicalName(String)}.
 */
final class ExpressionParser {

    private final String source;
    private int pos;

    private ExpressionParser(String source) {
        this.source = source;
    }

    /**
     * Parses a complete expression.
     *
     * @throws ExpressionSyntaxException if the text is empty, malformed, or has trailing input
     */
    static Expr parse(String source) {
        ExpressionParser parser = new ExpressionParser(source);
        parser.skipWhitespace();
        if (parser.atEnd()) {
            throw new ExpressionSyntaxException("Empty expression", 0);
        }
        Expr expr = parser.parseSum();
        parser.skipWhitespace();
        if (!parser.atEnd()) {
            throw parser.error("Unexpected '" + parser.source.charAt(parser.pos) + "'");
        }
        return expr;
    }

    private Expr parseSum() {
        List<Expr> terms = new ArrayList<>();
        terms.add(parseProduct());
        while (true) {
            skipWhitespace();
            if (accept('+')) {
                terms.add(parseProduct());
            } else if (accept('-')) {
                terms.add(negate(parseProduct()));
            } else {
                break;
            }
        }
        return terms.size() == 1 ? terms.get(0) : new Add(terms);
    }

    private Expr parseProduct() {
        List<Expr> factors = new ArrayList<>();
        addFactor(factors, parseUnary());
        while (true) {
            skipWhitespace();
            if (peek() == '*' && peekAt(1) != '*') {
                pos++;
                addFactor(factors, parseUnary());
            } else if (accept('/')) {
                factors.add(new Pow(parseUnary(), Num.MINUS_ONE));
            } else {
                break;
            }
        }
        return factors.size() == 1 ? factors.get(0) : new Mul(factors);
    }

    /** Products are associative; {@code -I*theta} reads as one product of three factors. */
    private static void addFactor(List<Expr> factors, Expr factor) {
        if (factor instanceof Mul mul) {
            factors.addAll(mul.factors());
        } else {
            factors.add(factor);
        }
    }

    private Expr parseUnary() {
        skipWhitespace();
        if (accept('-')) {
            return negate(parseUnary());
        }
        if (accept('+')) {
            return parseUnary();
        }
        return parsePower();
    }

    private Expr parsePower() {
        Expr base = parsePrimary();
        skipWhitespace();
        if (peek() == '*' && peekAt(1) == '*') {
            pos += 2;
            return new Pow(base, parseUnary());
        }
        if (accept('^')) {
            return new Pow(base, parseUnary());
        }
        return base;
    }

    private Expr parsePrimary() {
        skipWhitespace();
        int c = peek();
        if (c == -1) {
            throw error("Unexpected end of expression");
        }
        if (c == '(') {
            pos++;
            Expr inner = parseSum();
            expect(')');
            return inner;
        }
        if (Character.isDigit(c) || c == '.') {
            return parseNumber();
        }
        if (Character.isLetter(c) || c == '_') {
            return parseIdentifier();
        }
        throw error("Unexpected '" + (char) c + "'");
    }

    private Expr parseNumber() {
        int start = pos;
        while (Character.isDigit(peek()) || peek() == '.') {
            pos++;
        }
        String text = source.substring(start, pos);
        try {
            return Num.parse(text);
        } catch (NumberFormatException e) {
            throw new ExpressionSyntaxException("Malformed number '" + text + "'", start);
        }
    }

    private Expr parseIdentifier() {
        int start = pos;
        while (Character.isLetterOrDigit(peek()) || peek() == '_') {
            pos++;
        }
        String name = source.substring(start, pos);
        skipWhitespace();
        if (!accept('(')) {
            return "I".equals(name) ? Const.IMAGINARY_UNIT : new Sym(name);
        }
        Expr argument = parseSum();
        skipWhitespace();
        if (peek() == ',') {
            throw error("Function '" + name + "' takes exactly one argument");
        }
        expect(')');
        String function = Functions.canonicalName(name);
        if ("sqrt".equals(function)) {
            return new Pow(argument, Num.of(1, 2));
        }
        return new Fn(function, argument);
    }

    private static Expr negate(Expr expr) {
        if (expr instanceof Num num) {
            return num.negate();
        }
        if (expr instanceof Mul mul) {
            List<Expr> factors = new ArrayList<>(mul.factors().size() + 1);
            factors.add(Num.MINUS_ONE);
            factors.addAll(mul.factors());
            return new Mul(factors);
        }
        return Mul.of(Num.MINUS_ONE, expr);
    }

    private void expect(char expected) {
        skipWhitespace();
        if (!accept(expected)) {
            throw error("Expected '" + expected + "'");
        }
    }

    private boolean accept(char expected) {
        if (peek() == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private int peek() {
        return peekAt(0);
    }

    private int peekAt(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : -1;
    }

    private boolean atEnd() {
        return pos >= source.length();
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private ExpressionSyntaxException error(String message) {
        return new ExpressionSyntaxException(message + " at position " + pos + " in '" + source + "'", pos);
    }
}
