package io.mathxform.core.algebra;

import java.util.List;
import java.util.Objects;

/** A free variable. */
public record Sym(String name) implements Expr {

    public Sym {
        Objects.requireNonNull(name, "name must not be null");
    }

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
