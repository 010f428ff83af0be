package io.mathxform.core.model;

import java.util.List;
import java.util.Objects;

/** An expression node annotated with its id, and its children annotated the same way. */
public record AddressedNode(ExpressionNode node, NodeId id, String canonical, List<AddressedNode> children) {

    public AddressedNode {
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(canonical, "canonical must not be null");
        children = List.copyOf(children);
    }
}
