package io.mathxform.core.algebra;

import java.util.List;
import java.util.Objects;

/** Unevaluated derivative marker {@code d(body)/d(variable)}. */
public record Deriv(Expr body, Sym variable) implements Expr {

    public Deriv {
        Objects.requireNonNull(body, "body must not be null");
        Objects.requireNonNull(variable, "variable must not be null");
    }

    @Override
    public List<Expr> args() {
        return List.of(body, variable);
    }

    @Override
    public Expr withArgs(List<Expr> args) {
        Expr variableArg = args.get(1);
        if (!(variableArg instanceof Sym sym)) {
            throw new IllegalArgumentException("derivative variable must be a symbol, got: " + variableArg);
        }
        return new Deriv(args.get(0), sym);
    }

    @Override
    public String toString() {
        return ExprFormatter.format(this);
    }
}
