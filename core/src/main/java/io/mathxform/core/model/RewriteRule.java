package io.mathxform.core.model;

import io.mathxform.core.algebra.Binding;
import io.mathxform.core.algebra.Expr;
import io.mathxform.core.spi.AlgebraEngine;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * A named bidirectional rewrite rule compiled from one catalog line.
 *
 * <p>
 * Templates are the literal parses of the two sides. Patterns are the same trees with every
 * variable in {@code wildcardNames} replaced by a wildcard. Immutable and shared by all requests.
 */
public record RewriteRule(
        String name,
        String label,
        Expr leftPattern,
        Expr rightPattern,
        Expr leftTemplate,
        Expr rightTemplate,
        Set<String> wildcardNames,
        List<RuleCapability> capabilities) {

    public RewriteRule {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(leftPattern, "leftPattern must not be null");
        Objects.requireNonNull(rightPattern, "rightPattern must not be null");
        Objects.requireNonNull(leftTemplate, "leftTemplate must not be null");
        Objects.requireNonNull(rightTemplate, "rightTemplate must not be null");
        wildcardNames = Collections.unmodifiableSortedSet(new TreeSet<>(wildcardNames));
        capabilities = capabilities.isEmpty() ? List.of(PlainRule.INSTANCE) : List.copyOf(capabilities);
    }

    /** Returns a copy of this rule carrying the given capabilities instead. */
    public RewriteRule withCapabilities(List<RuleCapability> replacement) {
        return new RewriteRule(
                name, label, leftPattern, rightPattern, leftTemplate, rightTemplate, wildcardNames, replacement);
    }

    public boolean admits(Binding binding, Assumptions assumptions) {
        for (RuleCapability capability : capabilities) {
            if (!capability.admits(binding, assumptions)) {
                return false;
            }
        }
        return true;
    }

    public Expr postProcess(Expr replacement, AlgebraEngine engine) {
        Expr result = replacement;
        for (RuleCapability capability : capabilities) {
            result = capability.postProcess(result, engine);
        }
        return result;
    }

    public boolean alwaysShow() {
        return capabilities.stream().anyMatch(RuleCapability::alwaysShow);
    }
}
