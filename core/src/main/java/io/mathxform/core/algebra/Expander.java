package io.mathxform.core.algebra;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Distributes products over sums and multiplies out small positive integer powers of sums. Like
 * terms are merged after every factor; a product whose expansion would exceed
 * {@value #MAX_EXPANDED_TERMS} terms is left as it is.
 */
final class Expander {

    private static final int MAX_EXPANDED_EXPONENT = 12;
    static final int MAX_EXPANDED_TERMS = 1024;

    private Expander() {}

    static Expr expand(Expr expr) {
        Expr normalized = Normalizer.normalize(expr);
        return Normalizer.normalize(Exprs.transformUp(normalized, Expander::expandNode));
    }

    private static Expr expandNode(Expr node) {
        if (node instanceof Mul mul) {
            return distribute(mul.factors()).orElseGet(() -> Normalizer.normalize(node));
        }
        if (node instanceof Pow pow
                && pow.base() instanceof Add
                && pow.exponent() instanceof Num exponent
                && exponent.isInteger()
                && exponent.signum() > 0
                && exponent.compareTo(Num.of(MAX_EXPANDED_EXPONENT)) <= 0) {
            int n = exponent.intValueExact();
            List<Expr> copies = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                copies.add(pow.base());
            }
            return distribute(copies).orElseGet(() -> Normalizer.normalize(node));
        }
        return Normalizer.normalize(node);
    }

    private static Optional<Expr> distribute(List<Expr> factors) {
        List<Expr> products = List.of(Num.ONE);
        for (Expr factor : factors) {
            List<Expr> terms = factor instanceof Add add ? add.terms() : List.of(factor);
            if ((long) products.size() * terms.size() > MAX_EXPANDED_TERMS) {
                return Optional.empty();
            }
            List<Expr> next = new ArrayList<>(products.size() * terms.size());
            for (Expr partial : products) {
                for (Expr term : terms) {
                    next.add(Normalizer.product(List.of(partial, term)));
                }
            }
            Expr merged = Normalizer.sum(next);
            products = merged instanceof Add add ? add.terms() : List.of(merged);
        }
        return Optional.of(Normalizer.sum(products));
    }
}
