package io.mathxform.core.catalog;

import io.mathxform.core.algebra.Binding;
import io.mathxform.core.algebra.Expr;
import io.mathxform.core.algebra.Sym;
import io.mathxform.core.model.AlwaysShowRule;
import io.mathxform.core.model.Assumptions;
import io.mathxform.core.model.GuardedRule;
import io.mathxform.core.model.NormalizingRule;
import io.mathxform.core.model.RewriteRule;
import io.mathxform.core.model.RuleCapability;
import io.mathxform.core.spi.AlgebraEngine;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Capabilities attached to catalog rules by name at load time. Rules not listed stay plain.
 *
 * <p>
 * Thread-safe: immutable after construction.
 */
public final class RuleCapabilityRegistry {

    public static final String CONJUGATE_EXP_I_THETA = "conjugate_exp_i_theta";
    public static final String COMPLETE_SQUARE = "complete_square";
    public static final String COMBINE_LIKE_TERMS_ADD = "combine_like_terms_add";

    private final Map<String, List<RuleCapability>> capabilities;

    public RuleCapabilityRegistry(Map<String, List<RuleCapability>> capabilities) {
        Map<String, List<RuleCapability>> copy = new HashMap<>();
        capabilities.forEach((name, list) -> copy.put(name, List.copyOf(list)));
        this.capabilities = Collections.unmodifiableMap(copy);
    }

    public static RuleCapabilityRegistry empty() {
        return new RuleCapabilityRegistry(Map.of());
    }

    /** The registry used for the bundled catalog. */
    public static RuleCapabilityRegistry defaults() {
        return new RuleCapabilityRegistry(Map.of(
                CONJUGATE_EXP_I_THETA,
                List.of(new GuardedRule("theta is a real or positive symbol", RuleCapabilityRegistry::realAngle)),
                COMPLETE_SQUARE,
                List.of(
                        new GuardedRule("x is a bare symbol", (binding, assumptions) -> binding.get("x")
                                .filter(Sym.class::isInstance)
                                .isPresent()),
                        new NormalizingRule("simplify", RuleCapabilityRegistry::simplify)),
                COMBINE_LIKE_TERMS_ADD,
                List.of(AlwaysShowRule.INSTANCE)));
    }

    public Optional<List<RuleCapability>> capabilitiesFor(String ruleName) {
        return Optional.ofNullable(capabilities.get(ruleName));
    }

    /** Returns the rule with its registered capabilities, or the rule unchanged. */
    public RewriteRule attach(RewriteRule rule) {
        return capabilitiesFor(rule.name()).map(rule::withCapabilities).orElse(rule);
    }

    private static Expr simplify(Expr replacement, AlgebraEngine engine) {
        return engine.simplify(replacement);
    }

    private static boolean realAngle(Binding binding, Assumptions assumptions) {
        Optional<Expr> theta = binding.get("theta");
        if (theta.isEmpty() || !(theta.get() instanceof Sym symbol)) {
            return false;
        }
        return assumptions.has(symbol.name(), "real") || assumptions.has(symbol.name(), "positive");
    }
}
