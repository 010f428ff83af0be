package io.mathxform.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import io.mathxform.core.algebra.Add;
import io.mathxform.core.algebra.Binding;
import io.mathxform.core.algebra.Expr;
import io.mathxform.core.algebra.Mul;
import io.mathxform.core.algebra.Num;
import io.mathxform.core.algebra.Sym;
import io.mathxform.core.algebra.SymbolicAlgebraEngine;
import io.mathxform.core.algebra.Wild;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RewriteRule capabilities")
class RewriteRuleTest {

    private static final Sym A = new Sym("a");

    private static RewriteRule rule(List<RuleCapability> capabilities) {
        return new RewriteRule("r", "r", new Wild("a"), new Wild("a"), A, A, Set.of("a"), capabilities);
    }

    @Test
    @DisplayName("A rule without capabilities is plain")
    void plainByDefault() {
        RewriteRule rule = rule(List.of());

        assertThat(rule.capabilities()).containsExactly(PlainRule.INSTANCE);
        assertThat(rule.admits(Binding.empty(), Assumptions.none())).isTrue();
        assertThat(rule.alwaysShow()).isFalse();
        assertThat(rule.postProcess(A, new SymbolicAlgebraEngine())).isEqualTo(A);
    }

    @Test
    @DisplayName("Guards see the binding and the assumptions")
    void guarded() {
        RewriteRule rule = rule(List.of(new GuardedRule(
                "a is real", (binding, assumptions) -> assumptions.has("a", "real"))));

        assertThat(rule.admits(Binding.empty(), Assumptions.none())).isFalse();
        assertThat(rule.admits(Binding.empty(), Assumptions.of(Map.of("a", "real")))).isTrue();
    }

    @Test
    @DisplayName("Capabilities compose in order")
    void composes() {
        RewriteRule rule = rule(List.of(
                new NormalizingRule("simplify", (expr, engine) -> engine.simplify(expr)),
                AlwaysShowRule.INSTANCE));

        Expr raw = Add.of(A, A);

        assertThat(rule.postProcess(raw, new SymbolicAlgebraEngine()))
                .isEqualTo(Mul.of(Num.TWO, A));
        assertThat(rule.alwaysShow()).isTrue();
    }

    @Test
    @DisplayName("withCapabilities replaces, keeping the rest")
    void withCapabilities() {
        RewriteRule rule = rule(List.of()).withCapabilities(List.of(AlwaysShowRule.INSTANCE));

        assertThat(rule.capabilities()).containsExactly(AlwaysShowRule.INSTANCE);
        assertThat(rule.name()).isEqualTo("r");
        assertThat(rule.wildcardNames()).containsExactly("a");
    }
}
