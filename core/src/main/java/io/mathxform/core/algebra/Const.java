package io.mathxform.core.algebra;

import java.util.List;

/** A named mathematical constant. The imaginary unit is the only one the engine knows. */
public record Const(String name) implements Expr {

    public static final Const IMAGINARY_UNIT = new Const("I");

    @Override
    public List<Expr> args() {
        return List.of();
    }

    @Override
    public Expr withArgs(List<Expr> args) {
        return this;
    }

    @Override
    public String toString() {
        return name;
    }
}
