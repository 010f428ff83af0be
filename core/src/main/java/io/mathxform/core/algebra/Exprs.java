package io.mathxform.core.algebra;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/** Tree utilities shared by the engine's passes. */
final class Exprs {

    private Exprs() {}

    static boolean anyMatch(Expr expr, Predicate<Expr> predicate) {
        if (predicate.test(expr)) {
            return true;
        }
        for (Expr child : expr.args()) {
            if (anyMatch(child, predicate)) {
                return true;
            }
        }
        return false;
    }

    /** Rebuilds the tree bottom-up, applying {@code fn} to every node after its children. */
    static Expr transformUp(Expr expr, UnaryOperator<Expr> fn) {
        List<Expr> args = expr.args();
        if (args.isEmpty()) {
            return fn.apply(expr);
        }
        List<Expr> mapped = new ArrayList<>(args.size());
        boolean changed = false;
        for (Expr arg : args) {
            Expr next = transformUp(arg, fn);
            changed |= next != arg;
            mapped.add(next);
        }
        return fn.apply(changed ? expr.withArgs(mapped) : expr);
    }

    static boolean contains(Expr expr, Sym symbol) {
        return anyMatch(expr, e -> e.equals(symbol));
    }

    static SortedSet<String> freeSymbols(Expr expr) {
        SortedSet<String> names = new TreeSet<>();
        collectSymbols(expr, names);
        return names;
    }

    private static void collectSymbols(Expr expr, SortedSet<String> names) {
        if (expr instanceof Sym sym) {
            names.add(sym.name());
            return;
        }
        for (Expr child : expr.args()) {
            collectSymbols(child, names);
        }
    }

    /** The leading numeric coefficient of a term, {@code 1} when it has none. */
    static Num coefficient(Expr term) {
        if (term instanceof Num num) {
            return num;
        }
        if (term instanceof Mul mul && mul.factors().get(0) instanceof Num num) {
            return num;
        }
        return Num.ONE;
    }

    /** Returns {@code true} for a negative number or a product led by a negative coefficient. */
    static boolean isNegativeTerm(Expr term) {
        return coefficient(term).isNegative();
    }

    /** Flips the sign of the leading coefficient without normalizing anything else. */
    static Expr negateTerm(Expr term) {
        if (term instanceof Num num) {
            return num.negate();
        }
        if (term instanceof Mul mul && mul.factors().get(0) instanceof Num num) {
            List<Expr> rest = mul.factors().subList(1, mul.factors().size());
            if (num.equals(Num.MINUS_ONE)) {
                return rest.size() == 1 ? rest.get(0) : new Mul(rest);
            }
            List<Expr> factors = new ArrayList<>(mul.factors());
            factors.set(0, num.negate());
            return new Mul(factors);
        }
        return Mul.of(Num.MINUS_ONE, term);
    }
}
