package io.mathxform.core.algebra;

import java.util.List;
import java.util.Objects;

/**
 * Unary function application. Names listed in {@link Functions} are interpreted by the engine;
 * any other name is an opaque, uninterpreted function.
 */
public record Fn(String name, Expr argument) implements Expr {

    public Fn {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(argument, "argument must not be null");
    }

    @Override
    public List<Expr> args() {
        return List.of(argument);
    }

    @Override
    public Expr withArgs(List<Expr> args) {
        return new Fn(name, args.get(0));
    }

    @Override
    public String toString() {
        return ExprFormatter.format(this);
    }
}
