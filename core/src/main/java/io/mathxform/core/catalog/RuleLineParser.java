package io.mathxform.core.catalog;

import io.mathxform.core.algebra.Binding;
import io.mathxform.core.algebra.Expr;
import io.mathxform.core.algebra.Wild;
import io.mathxform.core.error.ExpressionSyntaxException;
import io.mathxform.core.error.RuleLoadException;
import io.mathxform.core.model.RewriteRule;
import io.mathxform.core.spi.AlgebraEngine;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Compiles one catalog line of the form
 *
 * <pre>
 * left rewrite right  # rule: name | label: text
 * </pre>
 *
 * into a {@link RewriteRule}. Every free symbol of either side becomes a wildcard of the rule. The
 * templates keep the literal shape of each side; the patterns are brought into the same normal form
 * as the targets they are matched against, so {@code a + a} matches {@code 2*y}.
 */
public final class RuleLineParser {

    static final String KEYWORD = "rewrite";
    private static final String NAME_PREFIX = "rule:";
    private static final String LABEL_PREFIX = "label:";

    private final AlgebraEngine engine;

    public RuleLineParser(AlgebraEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    /**
     * Parses a single line.
     *
     * @param line raw line text
     * @param source file path or resource name, used in error reports
     * @param lineNumber 1-based line number, used in error reports
     * @return the compiled rule, or empty for blank and comment-only lines
     * @throws RuleLoadException if the line is not a well-formed rule
     */
    public Optional<RewriteRule> parse(String line, String source, int lineNumber) {
        String trimmed = line.strip();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
            return Optional.empty();
        }

        int hash = trimmed.indexOf('#');
        String body = (hash < 0 ? trimmed : trimmed.substring(0, hash)).strip();
        String meta = hash < 0 ? "" : trimmed.substring(hash + 1);

        int keyword = body.indexOf(KEYWORD);
        if (keyword < 0) {
            throw new RuleLoadException("Missing '" + KEYWORD + "' keyword", source, lineNumber);
        }
        if (body.indexOf(KEYWORD, keyword + KEYWORD.length()) >= 0) {
            throw new RuleLoadException("'" + KEYWORD + "' must appear exactly once", source, lineNumber);
        }
        String leftText = body.substring(0, keyword).strip();
        String rightText = body.substring(keyword + KEYWORD.length()).strip();
        if (leftText.isEmpty() || rightText.isEmpty()) {
            throw new RuleLoadException("Both sides of a rule must be non-empty", source, lineNumber);
        }

        String name = null;
        String label = null;
        for (String chunk : meta.split("\\|")) {
            String part = chunk.strip();
            String lower = part.toLowerCase(Locale.ROOT);
            if (lower.startsWith(NAME_PREFIX)) {
                name = part.substring(NAME_PREFIX.length()).strip();
            } else if (lower.startsWith(LABEL_PREFIX)) {
                label = part.substring(LABEL_PREFIX.length()).strip();
            }
        }
        if (name == null || name.isEmpty()) {
            name = defaultName(leftText, rightText);
        }
        if (label == null || label.isEmpty()) {
            label = leftText + " ↔ " + rightText;
        }

        Expr leftTemplate = parseSide(leftText, source, lineNumber);
        Expr rightTemplate = parseSide(rightText, source, lineNumber);

        SortedSet<String> wildcards = new TreeSet<>(engine.freeSymbols(leftTemplate));
        wildcards.addAll(engine.freeSymbols(rightTemplate));
        Binding toWildcards = wildcardBinding(wildcards);

        return Optional.of(new RewriteRule(
                name,
                label,
                engine.simplify(engine.substitute(leftTemplate, toWildcards)),
                engine.simplify(engine.substitute(rightTemplate, toWildcards)),
                leftTemplate,
                rightTemplate,
                wildcards,
                List.of()));
    }

    static String defaultName(String left, String right) {
        return "rule_" + Math.abs((left + right).hashCode() % 10000);
    }

    private Expr parseSide(String text, String source, int lineNumber) {
        try {
            return engine.parse(text);
        } catch (ExpressionSyntaxException e) {
            throw new RuleLoadException("Cannot parse '" + text + "': " + e.getMessage(), e, source, lineNumber);
        }
    }

    private static Binding wildcardBinding(SortedSet<String> names) {
        Map<String, Expr> values = new LinkedHashMap<>();
        for (String name : names) {
            values.put(name, new Wild(name));
        }
        return Binding.of(values);
    }
}
