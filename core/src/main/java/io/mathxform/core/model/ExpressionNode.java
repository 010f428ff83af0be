package io.mathxform.core.model;

import java.util.List;

/**
 * Node of the internal expression tree parsed from Content MathML. Variants are immutable records;
 * operand order is exactly the markup's order, never sorted.
 */
public interface ExpressionNode {

    /** Direct children in markup order. */
    List<ExpressionNode> children();
}
