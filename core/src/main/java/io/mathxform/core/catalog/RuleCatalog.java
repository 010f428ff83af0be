package io.mathxform.core.catalog;

import io.mathxform.core.model.RewriteRule;
import java.util.List;
import java.util.Optional;

/**
 * Immutable, ordered collection of compiled rewrite rules. Built once by {@link RuleCatalogLoader}
 * and shared by every request.
 */
public final class RuleCatalog {

    private static final RuleCatalog EMPTY = new RuleCatalog(List.of());

    private final List<RewriteRule> rules;

    private RuleCatalog(List<RewriteRule> rules) {
        this.rules = rules;
    }

    public static RuleCatalog of(List<RewriteRule> rules) {
        return rules.isEmpty() ? EMPTY : new RuleCatalog(List.copyOf(rules));
    }

    public static RuleCatalog empty() {
        return EMPTY;
    }

    /** Rules in load order. */
    public List<RewriteRule> rules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    /** First rule with the given name. */
    Optional<RewriteRule> find(String name) {
        return rules.stream().filter(rule -> rule.name().equals(name)).findFirst();
    }

    @Override
    public String toString() {
        return "RuleCatalog[" + rules.size() + " rules]";
    }
}
