package io.mathxform.core.model;

import java.util.List;
import java.util.Objects;

/** {@code <apply><power/>base exponent</apply>}. */
public record Power(ExpressionNode base, ExpressionNode exponent) implements ExpressionNode {

    public Power {
        Objects.requireNonNull(base, "base must not be null");
        Objects.requireNonNull(exponent, "exponent must not be null");
    }

    @Override
    public List<ExpressionNode> children() {
        return List.of(base, exponent);
    }
}
