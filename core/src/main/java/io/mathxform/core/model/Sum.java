package io.mathxform.core.model;

import java.util.List;

/** {@code <apply><plus/>...</apply>} with any number of terms. */
public record Sum(List<ExpressionNode> terms) implements ExpressionNode {

    public Sum {
        terms = List.copyOf(terms);
    }

    @Override
    public List<ExpressionNode> children() {
        return terms;
    }
}
