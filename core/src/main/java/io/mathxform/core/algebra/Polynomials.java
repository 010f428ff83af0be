package io.mathxform.core.algebra;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Coefficient extraction for expressions that are polynomials in one variable. */
final class Polynomials {

    private static final int MAX_DEGREE = 64;

    private Polynomials() {}

    /**
     * Returns the coefficients of {@code expr} in {@code variable}, lowest degree first, with no
     * trailing zero coefficient. Empty when the expression is not a polynomial in the variable
     * (negative or symbolic powers of it, or the variable inside a function), and, before anything
     * is expanded, when its degree in the variable may exceed {@code maxDegree}.
     */
    static Optional<List<Expr>> coefficients(Expr expr, Sym variable, int maxDegree) {
        int bound = degreeBound(expr, variable);
        if (bound < 0 || bound > maxDegree) {
            return Optional.empty();
        }
        Expr expanded = Expander.expand(expr);
        List<Expr> terms = expanded instanceof Add add ? add.terms() : List.of(expanded);
        List<List<Expr>> byDegree = new ArrayList<>();
        for (Expr term : terms) {
            List<Expr> factors = term instanceof Mul mul ? mul.factors() : List.of(term);
            int degree = 0;
            List<Expr> coefficient = new ArrayList<>();
            for (Expr factor : factors) {
                if (factor.equals(variable)) {
                    degree += 1;
                } else if (factor instanceof Pow pow
                        && pow.base().equals(variable)
                        && pow.exponent() instanceof Num exponent
                        && exponent.isInteger()
                        && exponent.signum() > 0
                        && exponent.compareTo(Num.of(MAX_DEGREE)) <= 0) {
                    degree += exponent.intValueExact();
                } else if (Exprs.contains(factor, variable)) {
                    return Optional.empty();
                } else {
                    coefficient.add(factor);
                }
            }
            while (byDegree.size() <= degree) {
                byDegree.add(new ArrayList<>());
            }
            byDegree.get(degree).add(Normalizer.product(coefficient));
        }
        List<Expr> result = new ArrayList<>(byDegree.size());
        for (List<Expr> parts : byDegree) {
            result.add(Normalizer.sum(parts));
        }
        while (!result.isEmpty() && Num.ZERO.equals(result.get(result.size() - 1))) {
            result.remove(result.size() - 1);
        }
        return Optional.of(List.copyOf(result));
    }

    /**
     * Upper bound on the degree of {@code expr} in {@code variable}, read off the unexpanded tree.
     * Negative when the expression is plainly not a polynomial in the variable.
     */
    static int degreeBound(Expr expr, Sym variable) {
        if (expr.equals(variable)) {
            return 1;
        }
        if (!Exprs.contains(expr, variable)) {
            return 0;
        }
        if (expr instanceof Add add) {
            int max = 0;
            for (Expr term : add.terms()) {
                int degree = degreeBound(term, variable);
                if (degree < 0) {
                    return -1;
                }
                max = Math.max(max, degree);
            }
            return max;
        }
        if (expr instanceof Mul mul) {
            long total = 0;
            for (Expr factor : mul.factors()) {
                int degree = degreeBound(factor, variable);
                if (degree < 0) {
                    return -1;
                }
                total += degree;
            }
            return total > MAX_DEGREE ? -1 : (int) total;
        }
        if (expr instanceof Pow pow
                && pow.exponent() instanceof Num exponent
                && exponent.isInteger()
                && exponent.signum() > 0
                && exponent.compareTo(Num.of(MAX_DEGREE)) <= 0) {
            int base = degreeBound(pow.base(), variable);
            if (base < 0) {
                return -1;
            }
            long total = (long) base * exponent.intValueExact();
            return total > MAX_DEGREE ? -1 : (int) total;
        }
        return -1;
    }
}
