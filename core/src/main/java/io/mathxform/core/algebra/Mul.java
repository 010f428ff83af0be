package io.mathxform.core.algebra;

import java.util.List;

/** N-ary product. Factors keep the order they were built with. */
public record Mul(List<Expr> factors) implements Expr {

    public Mul {
        factors = List.copyOf(factors);
    }

    public static Mul of(Expr... factors) {
        return new Mul(List.of(factors));
    }

    @Override
    public List<Expr> args() {
        return factors;
    }

    @Override
    public Expr withArgs(List<Expr> args) {
        return new Mul(args);
    }

    @Override
    public String toString() {
        return ExprFormatter.format(this);
    }
}
