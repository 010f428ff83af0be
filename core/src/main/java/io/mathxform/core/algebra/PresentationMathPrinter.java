package io.mathxform.core.algebra;

import io.mathxform.core.error.ReplacementRenderException;
import io.mathxform.core.markup.MathMl;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Serializes an expression as Presentation MathML. Sum bases of powers are emitted without
 * fences; {@link io.mathxform.core.markup.PowerBaseGrouping} adds them afterwards.
 */
final class PresentationMathPrinter {

    private static final String MIDDLE_DOT = "·";
    private static final String OVERBAR = "¯";
    private static final String IMAGINARY_I = "ⅈ";

    private PresentationMathPrinter() {}

    static String print(Expr expr) {
        StringBuilder out = new StringBuilder();
        write(expr, out);
        return MathMl.presentationRoot(out.toString());
    }

    private static void write(Expr expr, StringBuilder out) {
        if (expr instanceof Sym sym) {
            identifier(sym.name(), out);
        } else if (expr instanceof Wild wild) {
            identifier(wild.name(), out);
        } else if (expr instanceof Num num) {
            number(num, out);
        } else if (Const.IMAGINARY_UNIT.equals(expr)) {
            out.append("<mi>").append(IMAGINARY_I).append("</mi>");
        } else if (expr instanceof Add add) {
            sum(add.terms(), out);
        } else if (expr instanceof Mul mul) {
            product(mul, out);
        } else if (expr instanceof Pow pow) {
            power(pow, out);
        } else if (expr instanceof Fn fn) {
            function(fn, out);
        } else if (expr instanceof Deriv deriv) {
            out.append("<mrow><mfrac><mi>d</mi><mrow><mi>d</mi>");
            identifier(deriv.variable().name(), out);
            out.append("</mrow></mfrac>");
            fenced(deriv.body(), out);
            out.append("</mrow>");
        } else {
            throw new ReplacementRenderException("No presentation markup for " + expr.getClass().getSimpleName());
        }
    }

    private static void identifier(String name, StringBuilder out) {
        out.append("<mi>").append(MathMl.escape(name)).append("</mi>");
    }

    private static void number(Num num, StringBuilder out) {
        if (num.isNegative()) {
            out.append("<mrow><mo>-</mo>");
            number(num.negate(), out);
            out.append("</mrow>");
        } else if (num.isInteger()) {
            out.append("<mn>").append(num.numerator()).append("</mn>");
        } else {
            out.append("<mfrac><mn>")
                    .append(num.numerator())
                    .append("</mn><mn>")
                    .append(num.denominator())
                    .append("</mn></mfrac>");
        }
    }

    private static void sum(List<Expr> terms, StringBuilder out) {
        out.append("<mrow>");
        for (int i = 0; i < terms.size(); i++) {
            Expr term = terms.get(i);
            if (i == 0) {
                operand(term, out);
            } else if (Exprs.isNegativeTerm(term)) {
                out.append("<mo>-</mo>");
                operand(Exprs.negateTerm(term), out);
            } else {
                out.append("<mo>+</mo>");
                operand(term, out);
            }
        }
        out.append("</mrow>");
    }

    /** A sum operand; nested sums are fenced. */
    private static void operand(Expr term, StringBuilder out) {
        if (term instanceof Add) {
            fenced(term, out);
        } else {
            write(term, out);
        }
    }

    private static void product(Mul mul, StringBuilder out) {
        if (Exprs.isNegativeTerm(mul)) {
            out.append("<mrow><mo>-</mo>");
            write(Exprs.negateTerm(mul), out);
            out.append("</mrow>");
            return;
        }
        List<Expr> numerator = new ArrayList<>();
        List<Expr> denominator = new ArrayList<>();
        for (Expr factor : mul.factors()) {
            if (factor instanceof Num num && !num.isInteger()) {
                if (!num.numerator().equals(BigInteger.ONE)) {
                    numerator.add(Num.of(num.numerator()));
                }
                denominator.add(Num.of(num.denominator()));
            } else if (factor instanceof Pow pow && pow.exponent() instanceof Num exponent && exponent.isNegative()) {
                Num positive = exponent.negate();
                denominator.add(positive.isOne() ? pow.base() : new Pow(pow.base(), positive));
            } else {
                numerator.add(factor);
            }
        }
        if (denominator.isEmpty()) {
            factors(numerator, out);
            return;
        }
        out.append("<mfrac>");
        factors(numerator.isEmpty() ? List.of(Num.ONE) : numerator, out);
        factors(denominator, out);
        out.append("</mfrac>");
    }

    private static void factors(List<Expr> factors, StringBuilder out) {
        if (factors.size() == 1) {
            write(factors.get(0), out);
            return;
        }
        out.append("<mrow>");
        for (int i = 0; i < factors.size(); i++) {
            Expr factor = factors.get(i);
            if (i > 0) {
                Expr previous = factors.get(i - 1);
                if (previous instanceof Num && factor instanceof Num) {
                    out.append("<mo>").append(MIDDLE_DOT).append("</mo>");
                } else if (!(previous instanceof Num)) {
                    out.append("<mo>").append(MathMl.INVISIBLE_TIMES).append("</mo>");
                }
            }
            if (factor instanceof Add || factor instanceof Num num && num.isNegative()) {
                fenced(factor, out);
            } else {
                write(factor, out);
            }
        }
        out.append("</mrow>");
    }

    private static void power(Pow pow, StringBuilder out) {
        Expr base = pow.base();
        if (pow.exponent() instanceof Num exponent) {
            if (exponent.equals(Num.of(1, 2))) {
                out.append("<msqrt>");
                write(base, out);
                out.append("</msqrt>");
                return;
            }
            if (exponent.isNegative()) {
                Num positive = exponent.negate();
                out.append("<mfrac><mn>1</mn>");
                write(positive.isOne() ? base : new Pow(base, positive), out);
                out.append("</mfrac>");
                return;
            }
        }
        out.append("<msup>");
        if (base instanceof Mul || base instanceof Pow || base instanceof Num num && (num.isNegative() || !num.isInteger())) {
            fenced(base, out);
        } else {
            write(base, out);
        }
        write(pow.exponent(), out);
        out.append("</msup>");
    }

    private static void function(Fn fn, StringBuilder out) {
        switch (fn.name()) {
            case Functions.EXP:
                out.append("<msup><mi>e</mi>");
                write(fn.argument(), out);
                out.append("</msup>");
                break;
            case Functions.ABS:
                out.append("<mrow><mo>|</mo>");
                write(fn.argument(), out);
                out.append("<mo>|</mo></mrow>");
                break;
            case Functions.CONJUGATE:
                out.append("<mover accent=\"true\"><mrow>");
                write(fn.argument(), out);
                out.append("</mrow><mo>").append(OVERBAR).append("</mo></mover>");
                break;
            default:
                out.append("<mrow>");
                identifier(fn.name(), out);
                out.append("<mo>(</mo>");
                write(fn.argument(), out);
                out.append("<mo>)</mo></mrow>");
        }
    }

    private static void fenced(Expr expr, StringBuilder out) {
        out.append("<mrow><mo>(</mo>");
        write(expr, out);
        out.append("<mo>)</mo></mrow>");
    }
}
