package io.mathxform.core.algebra;

import java.util.List;
import java.util.Objects;

/** A named placeholder in a rule pattern; binds to any subexpression during matching. */
public record Wild(String name) implements Expr {

    public Wild {
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
        return name + "_";
    }
}
