package io.mathxform.core.engine;

import io.mathxform.core.algebra.Expr;
import java.util.Objects;

/**
 * A replacement expression before it is rendered to markup.
 *
 * @param id option id
 * @param label human-readable description
 * @param ruleName rule or generator family, used for deduplication priority
 * @param replacement the replacement expression
 */
public record Suggestion(String id, String label, String ruleName, Expr replacement) {

    public Suggestion {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(ruleName, "ruleName must not be null");
        Objects.requireNonNull(replacement, "replacement must not be null");
    }
}
