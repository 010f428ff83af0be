package io.mathxform.core.algebra;

import java.util.List;
import java.util.Objects;

/** {@code base ** exponent}. Division is represented as a power with exponent {@code -1}. */
public record Pow(Expr base, Expr exponent) implements Expr {

    public Pow {
        Objects.requireNonNull(base, "base must not be null");
        Objects.requireNonNull(exponent, "exponent must not be null");
    }

    @Override
    public List<Expr> args() {
        return List.of(base, exponent);
    }

    @Override
    public Expr withArgs(List<Expr> args) {
        return new Pow(args.get(0), args.get(1));
    }

    @Override
    public String toString() {
        return ExprFormatter.format(this);
    }
}
