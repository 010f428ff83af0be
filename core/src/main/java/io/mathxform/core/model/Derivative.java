package io.mathxform.core.model;

import java.util.List;
import java.util.Objects;

/** {@code <apply><diff/>...</apply>}: derivative of {@code body} with respect to {@code variable}. */
public record Derivative(ExpressionNode variable, ExpressionNode body) implements ExpressionNode {

    public Derivative {
        Objects.requireNonNull(variable, "variable must not be null");
        Objects.requireNonNull(body, "body must not be null");
    }

    @Override
    public List<ExpressionNode> children() {
        return List.of(variable, body);
    }
}
