package io.mathxform.core.algebra;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Brings an expression into the engine's normal form: nested sums and products flattened, numbers
 * folded, like terms and like bases collected, trivial powers removed, a few function values
 * evaluated, and sum terms and product factors sorted by {@link ExprOrder}.
 *
 * <p>
 * Products are not distributed over sums; that is {@link Expander}'s job.
 */
final class Normalizer {

    private static final int MAX_PASSES = 4;

    private Normalizer() {}

    static Expr normalize(Expr expr) {
        if (expr instanceof Add add) {
            List<Expr> terms = new ArrayList<>(add.terms().size());
            for (Expr term : add.terms()) {
                terms.add(normalize(term));
            }
            return sum(terms);
        }
        if (expr instanceof Mul mul) {
            List<Expr> factors = new ArrayList<>(mul.factors().size());
            for (Expr factor : mul.factors()) {
                factors.add(normalize(factor));
            }
            return product(factors);
        }
        if (expr instanceof Pow pow) {
            return power(normalize(pow.base()), normalize(pow.exponent()));
        }
        if (expr instanceof Fn fn) {
            return function(fn.name(), normalize(fn.argument()));
        }
        if (expr instanceof Deriv deriv) {
            return new Deriv(normalize(deriv.body()), deriv.variable());
        }
        return expr;
    }

    /** Sum of already-normalized terms. */
    static Expr sum(List<Expr> terms) {
        List<Expr> flat = new ArrayList<>();
        for (Expr term : terms) {
            if (term instanceof Add nested) {
                flat.addAll(nested.terms());
            } else {
                flat.add(term);
            }
        }
        Num constant = Num.ZERO;
        Map<Expr, Num> coefficients = new LinkedHashMap<>();
        for (Expr term : flat) {
            if (term instanceof Num num) {
                constant = constant.add(num);
                continue;
            }
            Num coefficient = Exprs.coefficient(term);
            coefficients.merge(withoutCoefficient(term), coefficient, Num::add);
        }
        List<Expr> out = new ArrayList<>();
        for (Map.Entry<Expr, Num> entry : coefficients.entrySet()) {
            Num coefficient = entry.getValue();
            if (coefficient.isZero()) {
                continue;
            }
            out.add(scale(coefficient, entry.getKey()));
        }
        if (!constant.isZero()) {
            out.add(constant);
        }
        if (out.isEmpty()) {
            return Num.ZERO;
        }
        if (out.size() == 1) {
            return out.get(0);
        }
        out.sort(ExprOrder.TERMS);
        return new Add(out);
    }

    /** Product of already-normalized factors. */
    static Expr product(List<Expr> factors) {
        return product(factors, 0);
    }

    private static Expr product(List<Expr> factors, int pass) {
        List<Expr> flat = new ArrayList<>();
        for (Expr factor : factors) {
            if (factor instanceof Mul nested) {
                flat.addAll(nested.factors());
            } else {
                flat.add(factor);
            }
        }
        Num coefficient = Num.ONE;
        Map<Expr, List<Expr>> exponents = new LinkedHashMap<>();
        for (Expr factor : flat) {
            if (factor instanceof Num num) {
                coefficient = coefficient.multiply(num);
            } else if (factor instanceof Pow pow) {
                exponents.computeIfAbsent(pow.base(), k -> new ArrayList<>()).add(pow.exponent());
            } else {
                exponents.computeIfAbsent(factor, k -> new ArrayList<>()).add(Num.ONE);
            }
        }
        if (coefficient.isZero()) {
            return Num.ZERO;
        }
        List<Expr> out = new ArrayList<>();
        boolean regroup = false;
        for (Map.Entry<Expr, List<Expr>> entry : exponents.entrySet()) {
            List<Expr> collected = entry.getValue();
            Expr exponent = collected.size() == 1 ? collected.get(0) : sum(collected);
            Expr combined = power(entry.getKey(), exponent);
            if (combined instanceof Num num) {
                coefficient = coefficient.multiply(num);
            } else if (combined instanceof Mul mul) {
                out.addAll(mul.factors());
                regroup = true;
            } else {
                out.add(combined);
            }
        }
        if (regroup && pass < MAX_PASSES) {
            List<Expr> again = new ArrayList<>(out);
            again.add(coefficient);
            return product(again, pass + 1);
        }
        if (coefficient.isZero()) {
            return Num.ZERO;
        }
        out.sort(ExprOrder.FACTORS);
        if (!coefficient.isOne()) {
            out.add(0, coefficient);
        }
        if (out.isEmpty()) {
            return coefficient;
        }
        return out.size() == 1 ? out.get(0) : new Mul(out);
    }

    static Expr power(Expr base, Expr exponent) {
        if (exponent instanceof Num e) {
            if (e.isZero()) {
                return Num.ONE;
            }
            if (e.isOne()) {
                return base;
            }
        }
        if (base instanceof Num b) {
            if (b.isOne()) {
                return Num.ONE;
            }
            if (exponent instanceof Num e && e.isInteger()) {
                if (b.isZero()) {
                    return e.isNegative() ? new Pow(base, exponent) : Num.ZERO;
                }
                if (e.numerator().bitLength() < 16) {
                    return b.pow(e.intValueExact());
                }
            }
            return new Pow(base, exponent);
        }
        if (Const.IMAGINARY_UNIT.equals(base) && exponent instanceof Num e && e.isInteger()) {
            int k = e.numerator().mod(BigInteger.valueOf(4)).intValue();
            switch (k) {
                case 0:
                    return Num.ONE;
                case 1:
                    return Const.IMAGINARY_UNIT;
                case 2:
                    return Num.MINUS_ONE;
                default:
                    return new Mul(List.of(Num.MINUS_ONE, Const.IMAGINARY_UNIT));
            }
        }
        if (exponent instanceof Num e && e.isInteger()) {
            if (base instanceof Pow inner) {
                return power(inner.base(), product(List.of(inner.exponent(), e)));
            }
            if (base instanceof Mul mul) {
                List<Expr> factors = new ArrayList<>(mul.factors().size());
                for (Expr factor : mul.factors()) {
                    factors.add(power(factor, e));
                }
                return product(factors);
            }
        }
        return new Pow(base, exponent);
    }

    static Expr function(String name, Expr argument) {
        if (Functions.isOdd(name) && Exprs.isNegativeTerm(argument)) {
            return product(List.of(Num.MINUS_ONE, function(name, negate(argument))));
        }
        if (Functions.isEven(name) && Exprs.isNegativeTerm(argument)) {
            return function(name, negate(argument));
        }
        if (argument instanceof Num num) {
            if (num.isZero()) {
                switch (name) {
                    case Functions.SIN:
                    case Functions.TAN:
                        return Num.ZERO;
                    case Functions.COS:
                    case Functions.SEC:
                    case Functions.EXP:
                        return Num.ONE;
                    default:
                        break;
                }
            }
            if (num.isOne() && Functions.LOG.equals(name)) {
                return Num.ZERO;
            }
            if (Functions.ABS.equals(name)) {
                return num.abs();
            }
            if (Functions.CONJUGATE.equals(name)) {
                return num;
            }
        }
        if (Functions.CONJUGATE.equals(name)) {
            if (Const.IMAGINARY_UNIT.equals(argument)) {
                return new Mul(List.of(Num.MINUS_ONE, Const.IMAGINARY_UNIT));
            }
            if (argument instanceof Fn inner && Functions.CONJUGATE.equals(inner.name())) {
                return inner.argument();
            }
        }
        return new Fn(name, argument);
    }

    private static Expr negate(Expr expr) {
        return product(List.of(Num.MINUS_ONE, expr));
    }

    private static Expr withoutCoefficient(Expr term) {
        if (term instanceof Mul mul && mul.factors().get(0) instanceof Num) {
            List<Expr> rest = mul.factors().subList(1, mul.factors().size());
            return rest.size() == 1 ? rest.get(0) : new Mul(rest);
        }
        return term;
    }

    private static Expr scale(Num coefficient, Expr term) {
        if (coefficient.isOne()) {
            return term;
        }
        List<Expr> factors = new ArrayList<>();
        factors.add(coefficient);
        if (term instanceof Mul mul) {
            factors.addAll(mul.factors());
        } else {
            factors.add(term);
        }
        return new Mul(factors);
    }
}
