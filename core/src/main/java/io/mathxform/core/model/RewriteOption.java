package io.mathxform.core.model;

import java.util.Objects;

/**
 * One rewrite suggestion. Component names are the JSON field names of the response.
 *
 * @param id unique option id, e.g. {@code trig_double_angle_sin_forward}
 * @param label human-readable description of the rewrite
 * @param ruleName the catalog rule or generator family that produced it
 * @param replacementContentMathML replacement as Content MathML
 * @param replacementPresentationMathML replacement as Presentation MathML
 */
public record RewriteOption(
        String id,
        String label,
        String ruleName,
        String replacementContentMathML,
        String replacementPresentationMathML) {

    public RewriteOption {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(ruleName, "ruleName must not be null");
    }

    public static RewriteOption of(String id, String label, String ruleName, RenderedMarkup markup) {
        return new RewriteOption(id, label, ruleName, markup.structural(), markup.presentational());
    }
}
