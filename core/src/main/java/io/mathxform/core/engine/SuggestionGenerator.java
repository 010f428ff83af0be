package io.mathxform.core.engine;

import io.mathxform.core.algebra.Expr;
import io.mathxform.core.spi.AlgebraEngine;
import java.util.List;

/**
 * Parametric source of suggestions that a fixed-shape catalog rule cannot express, such as
 * completing the square for arbitrary coefficients.
 *
 * <p>
 * Implementations MUST be stateless and thread-safe.
 */
public interface SuggestionGenerator {

    /**
     * Proposes rewrites of {@code target}.
     *
     * @param target the normalized selected expression
     * @param engine the algebra engine
     * @return suggestions in the order they should be offered, possibly empty
     */
    List<Suggestion> generate(Expr target, AlgebraEngine engine);
}
