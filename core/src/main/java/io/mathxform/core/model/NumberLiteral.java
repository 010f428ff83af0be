package io.mathxform.core.model;

import java.util.List;
import java.util.Objects;

/**
 * {@code <cn>literal</cn>}. The literal is kept verbatim; it is only interpreted as a number when
 * the node is converted for the algebra engine.
 */
public record NumberLiteral(String literal) implements ExpressionNode {

    public NumberLiteral {
        Objects.requireNonNull(literal, "literal must not be null");
    }

    @Override
    public List<ExpressionNode> children() {
        return List.of();
    }
}
