package io.mathxform.core.addressing;

import io.mathxform.core.model.AddressedNode;
import io.mathxform.core.model.ExpressionNode;
import io.mathxform.core.model.NodeId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Assigns node ids to every subtree and resolves a caller's selected id back to a node.
 *
 * <p>
 * Ids are not disambiguated: two distinct subtrees whose canonical strings hash alike share an
 * id, and {@link #findById} returns the first in depth-first pre-order.
 */
public final class NodeAddressing {

    private NodeAddressing() {}

    /** Annotates the tree bottom-up; each canonical string is built once from its children's. */
    public static AddressedNode assignIds(ExpressionNode tree) {
        List<AddressedNode> children = new ArrayList<>(tree.children().size());
        List<String> canonicalChildren = new ArrayList<>(tree.children().size());
        for (ExpressionNode child : tree.children()) {
            AddressedNode addressed = assignIds(child);
            children.add(addressed);
            canonicalChildren.add(addressed.canonical());
        }
        String canonical = Canonicalizer.compose(tree, canonicalChildren);
        return new AddressedNode(tree, NodeId.of(canonical), canonical, children);
    }

    /**
     * Depth-first, pre-order search for the first node whose hex id equals {@code id}
     * (case-insensitive).
     *
     * @return the node, or empty when {@code id} is {@code null} or absent
     */
    public static Optional<AddressedNode> findById(AddressedNode tree, String id) {
        if (id == null) {
            return Optional.empty();
        }
        String wanted = id.trim().toLowerCase(Locale.ROOT);
        if (tree.id().hex().equals(wanted)) {
            return Optional.of(tree);
        }
        for (AddressedNode child : tree.children()) {
            Optional<AddressedNode> found = findById(child, wanted);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }
}
