package io.mathxform.core.model;

import java.util.List;

/**
 * {@code <apply><times/>...</apply>}. Addressed as a call to {@link #FUNCTION_NAME} wrapping a sum
 * of the factors, so its canonical form is {@code call:times(add(f1,...,fn))}.
 */
public record Product(List<ExpressionNode> factors) implements ExpressionNode {

    public static final String FUNCTION_NAME = "times";

    public Product {
        factors = List.copyOf(factors);
    }

    @Override
    public List<ExpressionNode> children() {
        return factors;
    }
}
