package io.mathxform.core.algebra;

import java.util.List;

/** N-ary sum. Terms keep the order they were built with. */
public record Add(List<Expr> terms) implements Expr {

    public Add {
        terms = List.copyOf(terms);
    }

    public static Add of(Expr... terms) {
        return new Add(List.of(terms));
    }

    @Override
    public List<Expr> args() {
        return terms;
    }

    @Override
    public Expr withArgs(List<Expr> args) {
        return new Add(args);
    }

    @Override
    public String toString() {
        return ExprFormatter.format(this);
    }
}
