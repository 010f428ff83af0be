package io.mathxform.core.algebra;

import java.util.List;

/**
 * Plain-text infix form of an expression ({@code 2*x**2 - sin(x)}), in the same syntax the rule
 * files use. Used for {@code toString}, the last-resort markup fallback and deterministic ordering.
 */
public final class ExprFormatter {

    private static final int SUM = 1;
    private static final int PRODUCT = 2;
    private static final int POWER = 3;
    private static final int ATOM = 4;

    private ExprFormatter() {}

    public static String format(Expr expr) {
        StringBuilder out = new StringBuilder();
        write(expr, out);
        return out.toString();
    }

    private static void write(Expr expr, StringBuilder out) {
        if (expr instanceof Sym || expr instanceof Wild || expr instanceof Num || expr instanceof Const) {
            out.append(expr.toString());
        } else if (expr instanceof Add add) {
            writeSum(add.terms(), out);
        } else if (expr instanceof Mul mul) {
            writeProduct(mul.factors(), out);
        } else if (expr instanceof Pow pow) {
            writeWrapped(pow.base(), POWER + 1, out);
            out.append("**");
            writeWrapped(pow.exponent(), ATOM, out);
        } else if (expr instanceof Fn fn) {
            out.append(fn.name()).append('(');
            write(fn.argument(), out);
            out.append(')');
        } else if (expr instanceof Deriv deriv) {
            out.append("Derivative(");
            write(deriv.body(), out);
            out.append(", ").append(deriv.variable().name()).append(')');
        } else {
            out.append(expr.getClass().getSimpleName());
        }
    }

    private static void writeSum(List<Expr> terms, StringBuilder out) {
        for (int i = 0; i < terms.size(); i++) {
            Expr term = terms.get(i);
            if (i == 0) {
                writeWrapped(term, PRODUCT, out);
            } else if (Exprs.isNegativeTerm(term)) {
                out.append(" - ");
                writeWrapped(Exprs.negateTerm(term), PRODUCT, out);
            } else {
                out.append(" + ");
                writeWrapped(term, PRODUCT, out);
            }
        }
    }

    private static void writeProduct(List<Expr> factors, StringBuilder out) {
        int start = 0;
        if (factors.size() > 1 && Num.MINUS_ONE.equals(factors.get(0))) {
            out.append('-');
            start = 1;
        }
        for (int i = start; i < factors.size(); i++) {
            if (i > start) {
                out.append('*');
            }
            Expr factor = factors.get(i);
            if (i == start && factor instanceof Num) {
                out.append(factor);
            } else {
                writeWrapped(factor, PRODUCT + 1, out);
            }
        }
    }

    private static void writeWrapped(Expr expr, int minPrecedence, StringBuilder out) {
        if (precedence(expr) < minPrecedence) {
            out.append('(');
            write(expr, out);
            out.append(')');
        } else {
            write(expr, out);
        }
    }

    private static int precedence(Expr expr) {
        if (expr instanceof Add) {
            return SUM;
        }
        if (expr instanceof Mul) {
            return PRODUCT;
        }
        if (expr instanceof Num num) {
            return num.isNegative() || !num.isInteger() ? PRODUCT : ATOM;
        }
        if (expr instanceof Pow) {
            return POWER;
        }
        return ATOM;
    }
}
