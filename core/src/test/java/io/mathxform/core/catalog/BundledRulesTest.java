package io.mathxform.core.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import io.mathxform.core.algebra.Binding;
import io.mathxform.core.algebra.Expr;
import io.mathxform.core.algebra.Sym;
import io.mathxform.core.algebra.SymbolicAlgebraEngine;
import io.mathxform.core.engine.SuggestionEngine;
import io.mathxform.core.markup.MarkupRenderer;
import io.mathxform.core.model.Assumptions;
import io.mathxform.core.model.RewriteOption;
import io.mathxform.core.model.RewriteRule;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Every bundled rule, applied to an instance of one of its own sides, must produce the other side,
 * and applying the opposite direction must lead back.
 */
@DisplayName("Bundled rules")
class BundledRulesTest {

    private static final SymbolicAlgebraEngine ALGEBRA = new SymbolicAlgebraEngine();
    private static final RuleCatalog BUNDLED =
            new RuleCatalogLoader(ALGEBRA).loadResources(RuleCatalogLoader.BUNDLED_RESOURCES);

    static Stream<String> bundledRuleNames() {
        return BUNDLED.rules().stream().map(RewriteRule::name);
    }

    private static RewriteRule bundled(String name) {
        return BUNDLED.find(name).orElseThrow();
    }

    /** Binds every wildcard to the symbol of the same name. */
    private static Binding ownSymbols(RewriteRule rule) {
        Map<String, Expr> values = new LinkedHashMap<>();
        rule.wildcardNames().forEach(name -> values.put(name, new Sym(name)));
        return Binding.of(values);
    }

    private static Assumptions allReal(RewriteRule rule) {
        Map<String, String> tags = new LinkedHashMap<>();
        rule.wildcardNames().forEach(name -> tags.put(name, "real"));
        return Assumptions.of(tags);
    }

    private static Expr instance(RewriteRule rule, Expr template) {
        return ALGEBRA.simplify(ALGEBRA.substitute(template, ownSymbols(rule)));
    }

    private static Expr rewrite(RewriteRule rule, Expr target, Expr pattern, Expr template) {
        Binding binding = ALGEBRA.match(target, pattern)
                .orElseThrow(() -> new AssertionError(rule.name() + ": " + pattern + " does not match " + target));
        assertThat(rule.admits(binding, allReal(rule))).as("%s admits %s", rule.name(), binding).isTrue();
        return ALGEBRA.simplify(rule.postProcess(ALGEBRA.substitute(template, binding), ALGEBRA));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("bundledRuleNames")
    @DisplayName("Forward then reverse returns the left side")
    void forwardThenReverse(String name) {
        RewriteRule rule = bundled(name);
        Expr left = instance(rule, rule.leftTemplate());

        Expr right = rewrite(rule, left, rule.leftPattern(), rule.rightTemplate());
        assertThat(right).isEqualTo(instance(rule, rule.rightTemplate()));

        assertThat(rewrite(rule, right, rule.rightPattern(), rule.leftTemplate())).isEqualTo(left);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("bundledRuleNames")
    @DisplayName("Reverse then forward returns the right side")
    void reverseThenForward(String name) {
        RewriteRule rule = bundled(name);
        Expr right = instance(rule, rule.rightTemplate());

        Expr left = rewrite(rule, right, rule.rightPattern(), rule.leftTemplate());
        assertThat(left).isEqualTo(instance(rule, rule.leftTemplate()));

        assertThat(rewrite(rule, left, rule.leftPattern(), rule.rightTemplate())).isEqualTo(right);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("bundledRuleNames")
    @DisplayName("No option repeats its target unless the rule always shows")
    void noIdentityOptions(String name) {
        RewriteRule rule = bundled(name);
        SuggestionEngine single =
                new SuggestionEngine(RuleCatalog.of(List.of(rule)), ALGEBRA, new MarkupRenderer(ALGEBRA), List.of());

        for (Expr target : List.of(instance(rule, rule.leftTemplate()), instance(rule, rule.rightTemplate()))) {
            List<RewriteOption> options = single.suggest(target, allReal(rule));

            assertThat(options).as("%s on %s", name, target).isNotEmpty();
            assertThat(options)
                    .filteredOn(option -> !(rule.alwaysShow() && option.id().endsWith("_reverse")))
                    .extracting(RewriteOption::replacementContentMathML)
                    .doesNotContain(ALGEBRA.printContent(target));
        }
    }
}
