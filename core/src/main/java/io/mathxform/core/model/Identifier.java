package io.mathxform.core.model;

import java.util.List;
import java.util.Objects;

/** {@code <ci>name</ci>}. */
public record Identifier(String name) implements ExpressionNode {

    public Identifier {
        Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public List<ExpressionNode> children() {
        return List.of();
    }
}
