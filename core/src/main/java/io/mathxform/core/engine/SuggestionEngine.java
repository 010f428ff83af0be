package io.mathxform.core.engine;

import io.mathxform.core.algebra.Binding;
import io.mathxform.core.algebra.Expr;
import io.mathxform.core.catalog.RuleCatalog;
import io.mathxform.core.markup.MarkupRenderer;
import io.mathxform.core.model.Assumptions;
import io.mathxform.core.model.RewriteOption;
import io.mathxform.core.model.RewriteRule;
import io.mathxform.core.spi.AlgebraEngine;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the ranked rewrite options for one selected expression.
 *
 * <p>
 * Every catalog rule is tried in catalog order, forward ({@code left -> right}) and then reverse
 * ({@code right -> left}), followed by the generators. Options rendering to the same content markup
 * are merged: the first one keeps its position, and a later one with a higher {@link RulePriority}
 * replaces it there. A rule replacement equal to the target is dropped, except in the reverse
 * direction of a rule that always shows.
 *
 * <p>
 * Thread-safe: all fields are immutable.
 */
public final class SuggestionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SuggestionEngine.class);

    static final String FORWARD_SUFFIX = "_forward";
    static final String REVERSE_SUFFIX = "_reverse";
    static final String REVERSE_LABEL_SUFFIX = " (reverse)";

    private final RuleCatalog catalog;
    private final AlgebraEngine algebra;
    private final MarkupRenderer renderer;
    private final List<SuggestionGenerator> generators;

    public SuggestionEngine(RuleCatalog catalog, AlgebraEngine algebra) {
        this(catalog, algebra, new MarkupRenderer(algebra), defaultGenerators());
    }

    public SuggestionEngine(
            RuleCatalog catalog,
            AlgebraEngine algebra,
            MarkupRenderer renderer,
            List<SuggestionGenerator> generators) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.algebra = Objects.requireNonNull(algebra, "algebra must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.generators = List.copyOf(generators);
    }

    /** Complete square, conjugate distribution, derivative evaluation. */
    public static List<SuggestionGenerator> defaultGenerators() {
        return List.of(
                new CompleteSquareGenerator(), new ConjugateDistributionGenerator(), new DerivativeGenerator());
    }

    /**
     * Returns the rewrite options for {@code target}.
     *
     * @param target the selected expression in normal form
     * @param assumptions caller-supplied variable assumptions
     * @return deduplicated options, possibly empty
     */
    public List<RewriteOption> suggest(Expr target, Assumptions assumptions) {
        List<Suggestion> suggestions = new ArrayList<>();
        for (RewriteRule rule : catalog.rules()) {
            try {
                applyRule(rule, target, assumptions, suggestions);
            } catch (RuntimeException e) {
                LOG.warn("Rule '{}' failed on {}, skipping: {}", rule.name(), target, e.getMessage());
            }
        }
        for (SuggestionGenerator generator : generators) {
            try {
                suggestions.addAll(generator.generate(target, algebra));
            } catch (RuntimeException e) {
                LOG.warn(
                        "Generator {} failed on {}, skipping: {}",
                        generator.getClass().getSimpleName(),
                        target,
                        e.getMessage());
            }
        }
        List<RewriteOption> options = deduplicate(suggestions);
        LOG.debug("{} candidate rewrites, {} options for {}", suggestions.size(), options.size(), target);
        return options;
    }

    private void applyRule(RewriteRule rule, Expr target, Assumptions assumptions, List<Suggestion> out) {
        instantiate(rule, target, assumptions, rule.leftPattern(), rule.rightTemplate(), false)
                .ifPresent(replacement ->
                        out.add(new Suggestion(rule.name() + FORWARD_SUFFIX, rule.label(), rule.name(), replacement)));
        instantiate(rule, target, assumptions, rule.rightPattern(), rule.leftTemplate(), rule.alwaysShow())
                .ifPresent(replacement -> out.add(new Suggestion(
                        rule.name() + REVERSE_SUFFIX, rule.label() + REVERSE_LABEL_SUFFIX, rule.name(), replacement)));
    }

    private Optional<Expr> instantiate(
            RewriteRule rule, Expr target, Assumptions assumptions, Expr pattern, Expr template, boolean showIdentity) {
        Optional<Binding> binding = algebra.match(target, pattern);
        if (binding.isEmpty() || !rule.admits(binding.get(), assumptions)) {
            return Optional.empty();
        }
        Expr replacement = rule.postProcess(algebra.substitute(template, binding.get()), algebra);
        if (!showIdentity && replacement.equals(target)) {
            return Optional.empty();
        }
        return Optional.of(replacement);
    }

    private List<RewriteOption> deduplicate(List<Suggestion> suggestions) {
        List<RewriteOption> options = new ArrayList<>();
        Map<String, Integer> positions = new HashMap<>();
        for (Suggestion suggestion : suggestions) {
            RewriteOption option = RewriteOption.of(
                    suggestion.id(),
                    suggestion.label(),
                    suggestion.ruleName(),
                    renderer.render(suggestion.replacement()));
            String key = option.replacementContentMathML().trim();
            Integer existing = positions.get(key);
            if (existing == null) {
                positions.put(key, options.size());
                options.add(option);
            } else if (RulePriority.of(option.ruleName()) > RulePriority.of(options.get(existing).ruleName())) {
                options.set(existing, option);
            }
        }
        return options;
    }
}
