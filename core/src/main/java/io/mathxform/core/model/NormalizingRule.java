package io.mathxform.core.model;

import io.mathxform.core.algebra.Expr;
import io.mathxform.core.spi.AlgebraEngine;
import java.util.Objects;
import java.util.function.BiFunction;

/** Runs a post-transform (typically simplification) on every instantiated replacement. */
public record NormalizingRule(String description, BiFunction<Expr, AlgebraEngine, Expr> postTransform)
        implements RuleCapability {

    public NormalizingRule {
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(postTransform, "postTransform must not be null");
    }

    @Override
    public Expr postProcess(Expr replacement, AlgebraEngine engine) {
        return postTransform.apply(replacement, engine);
    }

    @Override
    public String toString() {
        return "NormalizingRule[" + description + "]";
    }
}
