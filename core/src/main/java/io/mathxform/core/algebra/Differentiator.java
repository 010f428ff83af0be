package io.mathxform.core.algebra;

import java.util.ArrayList;
import java.util.List;

/**
 * Symbolic differentiation with the sum, product, power and chain rules. Functions without a known
 * derivative (opaque functions) are left as an unevaluated {@link Deriv}.
 */
final class Differentiator {

    private Differentiator() {}

    static Expr differentiate(Expr expr, Sym variable) {
        return Normalizer.normalize(derivative(expr, variable));
    }

    /** Replaces every {@link Deriv} marker, innermost first, with the derivative it denotes. */
    static Expr evaluateDerivatives(Expr expr) {
        Expr evaluated = Exprs.transformUp(expr, node -> node instanceof Deriv deriv
                ? differentiate(deriv.body(), deriv.variable())
                : node);
        return Normalizer.normalize(evaluated);
    }

    private static Expr derivative(Expr expr, Sym variable) {
        if (!Exprs.contains(expr, variable)) {
            return Num.ZERO;
        }
        if (expr instanceof Sym) {
            return Num.ONE;
        }
        if (expr instanceof Add add) {
            List<Expr> terms = new ArrayList<>(add.terms().size());
            for (Expr term : add.terms()) {
                terms.add(derivative(term, variable));
            }
            return new Add(terms);
        }
        if (expr instanceof Mul mul) {
            return productRule(mul.factors(), variable);
        }
        if (expr instanceof Pow pow) {
            return powerRule(pow, variable);
        }
        if (expr instanceof Fn fn) {
            return chainRule(fn, variable);
        }
        if (expr instanceof Deriv deriv) {
            return derivative(differentiate(deriv.body(), deriv.variable()), variable);
        }
        return new Deriv(expr, variable);
    }

    private static Expr productRule(List<Expr> factors, Sym variable) {
        List<Expr> terms = new ArrayList<>(factors.size());
        for (int i = 0; i < factors.size(); i++) {
            List<Expr> term = new ArrayList<>(factors);
            term.set(i, derivative(factors.get(i), variable));
            terms.add(new Mul(term));
        }
        return new Add(terms);
    }

    private static Expr powerRule(Pow pow, Sym variable) {
        Expr base = pow.base();
        Expr exponent = pow.exponent();
        if (!Exprs.contains(exponent, variable)) {
            return Mul.of(exponent, new Pow(base, Add.of(exponent, Num.MINUS_ONE)), derivative(base, variable));
        }
        Expr logarithmic = Add.of(
                Mul.of(derivative(exponent, variable), new Fn(Functions.LOG, base)),
                Mul.of(exponent, derivative(base, variable), new Pow(base, Num.MINUS_ONE)));
        return Mul.of(pow, logarithmic);
    }

    private static Expr chainRule(Fn fn, Sym variable) {
        Expr u = fn.argument();
        Expr outer;
        switch (fn.name()) {
            case Functions.SIN:
                outer = new Fn(Functions.COS, u);
                break;
            case Functions.COS:
                outer = Mul.of(Num.MINUS_ONE, new Fn(Functions.SIN, u));
                break;
            case Functions.TAN:
                outer = new Pow(new Fn(Functions.COS, u), Num.of(-2));
                break;
            case Functions.COT:
                outer = Mul.of(Num.MINUS_ONE, new Pow(new Fn(Functions.SIN, u), Num.of(-2)));
                break;
            case Functions.SEC:
                outer = Mul.of(new Fn(Functions.SEC, u), new Fn(Functions.TAN, u));
                break;
            case Functions.CSC:
                outer = Mul.of(Num.MINUS_ONE, new Fn(Functions.CSC, u), new Fn(Functions.COT, u));
                break;
            case Functions.EXP:
                outer = fn;
                break;
            case Functions.LOG:
                outer = new Pow(u, Num.MINUS_ONE);
                break;
            case Functions.ABS:
                outer = Mul.of(u, new Pow(fn, Num.MINUS_ONE));
                break;
            case Functions.CONJUGATE:
                return new Fn(Functions.CONJUGATE, derivative(u, variable));
            default:
                return new Deriv(fn, variable);
        }
        return Mul.of(outer, derivative(u, variable));
    }
}
