package io.mathxform.core.spi;

import io.mathxform.core.algebra.Binding;
import io.mathxform.core.algebra.Expr;
import io.mathxform.core.algebra.Sym;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Symbolic algebra capability consumed by the adapter, the rule catalog and the suggestion engine.
 * The core owns none of these operations; it calls them and recovers from their failures.
 *
 * <p>
 * Implementations MUST be stateless and thread-safe. Expressions are immutable values.
 */
public interface AlgebraEngine {

    /**
     * Returns the engine identifier, e.g. {@code "symbolic"}.
     *
     * @return a non-null, non-empty identifier (lowercase, no spaces)
     */
    String id();

    /**
     * Parses infix source text without any simplification, preserving the author's literal shape.
     *
     * @param source an expression such as {@code a*x**2 + b*x + c}
     * @return the unevaluated expression
     * @throws io.mathxform.core.error.ExpressionSyntaxException if the text is malformed
     */
    Expr parse(String source);

    /** Returns the normal form of {@code expr}. */
    Expr simplify(Expr expr);

    /** Distributes products over sums and multiplies out small integer powers of sums. */
    Expr expand(Expr expr);

    /** Returns the simplified derivative of {@code expr} with respect to {@code variable}. */
    Expr differentiate(Expr expr, Sym variable);

    /** Evaluates every unevaluated derivative marker inside {@code expr}. */
    Expr evaluateDerivatives(Expr expr);

    /**
     * Matches {@code target} against a pattern containing wildcards.
     *
     * @return the binding of wildcard names, or empty when the pattern does not apply
     */
    Optional<Binding> match(Expr target, Expr pattern);

    /** Instantiates a template with a binding, without normalizing the result. */
    Expr substitute(Expr template, Binding binding);

    /** Names of the free symbols of {@code expr}, sorted. */
    SortedSet<String> freeSymbols(Expr expr);

    /**
     * Coefficients of {@code expr} as a polynomial in {@code variable}, lowest degree first.
     *
     * @param maxDegree the highest degree the caller accepts; larger inputs are rejected before
     *     they are expanded
     * @return the coefficients, or empty when {@code expr} is not a polynomial in the variable of
     *     degree at most {@code maxDegree}
     */
    Optional<List<Expr>> polynomialCoefficients(Expr expr, Sym variable, int maxDegree);

    /** Returns {@code true} if the engine has a native primitive for the named unary function. */
    boolean supportsFunction(String name);

    /**
     * Serializes to Content MathML wrapped in a namespaced {@code <math>} root.
     *
     * @throws io.mathxform.core.error.ReplacementRenderException if the expression has no markup form
     */
    String printContent(Expr expr);

    /**
     * Serializes to Presentation MathML wrapped in a block-display {@code <math>} root.
     *
     * @throws io.mathxform.core.error.ReplacementRenderException if the expression has no markup form
     */
    String printPresentation(Expr expr);
}
