package io.mathxform.core.algebra;

import java.util.Comparator;

/**
 * Canonical orderings used by {@link Normalizer}. Terms of a sum are ordered by descending degree,
 * with constants last. Factors of a product are ordered numbers first, then the imaginary unit,
 * symbols, function applications (by {@link Functions#NATIVE} order), sums and derivatives.
 */
final class ExprOrder {

    static final Comparator<Expr> TERMS = Comparator.comparingInt(ExprOrder::isNumber)
            .thenComparing(Comparator.comparingInt(ExprOrder::degree).reversed())
            .thenComparing(term -> ExprFormatter.format(stripCoefficient(term)))
            .thenComparing(term -> Exprs.coefficient(term), Num::compareTo);

    static final Comparator<Expr> FACTORS = Comparator.comparingInt(ExprOrder::category)
            .thenComparingInt(ExprOrder::functionRank)
            .thenComparing(factor -> ExprFormatter.format(base(factor)))
            .thenComparing(factor -> ExprFormatter.format(exponent(factor)));

    private ExprOrder() {}

    private static int isNumber(Expr term) {
        return term instanceof Num ? 1 : 0;
    }

    /** Total degree of a term; every non-numeric factor counts as degree one unless raised to an integer. */
    static int degree(Expr term) {
        if (term instanceof Mul mul) {
            int total = 0;
            for (Expr factor : mul.factors()) {
                total += degree(factor);
            }
            return total;
        }
        if (term instanceof Num || term instanceof Const) {
            return 0;
        }
        if (term instanceof Pow pow && pow.exponent() instanceof Num exponent && exponent.isInteger()) {
            return Math.max(exponent.numerator().intValue(), 0) * degree(pow.base());
        }
        return 1;
    }

    private static Expr stripCoefficient(Expr term) {
        if (term instanceof Mul mul && mul.factors().get(0) instanceof Num && mul.factors().size() > 1) {
            return mul.factors().size() == 2
                    ? mul.factors().get(1)
                    : new Mul(mul.factors().subList(1, mul.factors().size()));
        }
        return term;
    }

    private static int category(Expr factor) {
        Expr base = base(factor);
        if (base instanceof Num) {
            return 0;
        }
        if (base instanceof Const) {
            return 1;
        }
        if (base instanceof Sym || base instanceof Wild) {
            return 2;
        }
        if (base instanceof Fn) {
            return 3;
        }
        if (base instanceof Add) {
            return 4;
        }
        return 5;
    }

    private static int functionRank(Expr factor) {
        return base(factor) instanceof Fn fn ? Functions.rank(fn.name()) : 0;
    }

    private static Expr base(Expr factor) {
        return factor instanceof Pow pow ? pow.base() : factor;
    }

    private static Expr exponent(Expr factor) {
        return factor instanceof Pow pow ? pow.exponent() : Num.ONE;
    }
}
