package io.mathxform.core.model;

import java.util.List;
import java.util.Objects;

/** Application of a unary function, e.g. {@code <apply><sin/>x</apply>} or {@code <apply><ci>f</ci>x</apply>}. */
public record Call(String function, ExpressionNode argument) implements ExpressionNode {

    public Call {
        Objects.requireNonNull(function, "function must not be null");
        Objects.requireNonNull(argument, "argument must not be null");
    }

    @Override
    public List<ExpressionNode> children() {
        return List.of(argument);
    }
}
