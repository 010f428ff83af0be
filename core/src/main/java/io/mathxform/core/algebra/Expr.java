package io.mathxform.core.algebra;

import java.util.List;

/**
 * Immutable node of the algebra engine's native expression representation.
 *
 * <p>
 * Implementations are records, so {@code equals} is structural: two expressions are equal when
 * they have the same kind and equal children in the same order. Normalized expressions (see {@link
 * Normalizer}) keep sums and products in a canonical order, which makes structural equality a
 * usable "same expression" test.
 */
public interface Expr {

    /** Direct children, in order. Leaves return an empty list. */
    List<Expr> args();

    /** Returns a node of the same kind with the given children, without any normalization. */
    Expr withArgs(List<Expr> args);
}
