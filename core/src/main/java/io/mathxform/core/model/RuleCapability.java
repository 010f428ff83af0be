package io.mathxform.core.model;

import io.mathxform.core.algebra.Binding;
import io.mathxform.core.algebra.Expr;
import io.mathxform.core.spi.AlgebraEngine;

/**
 * Behaviour attached to a catalog rule at load time. Variants: {@link PlainRule}, {@link
 * GuardedRule}, {@link NormalizingRule}, {@link AlwaysShowRule}. A rule may carry several.
 */
public interface RuleCapability {

    /** Whether a match with this binding may be offered under the caller's assumptions. */
    default boolean admits(Binding binding, Assumptions assumptions) {
        return true;
    }

    /** Transforms the instantiated replacement before it is compared and rendered. */
    default Expr postProcess(Expr replacement, AlgebraEngine engine) {
        return replacement;
    }

    /** Whether to offer the replacement even when it is structurally identical to the target. */
    default boolean alwaysShow() {
        return false;
    }
}
