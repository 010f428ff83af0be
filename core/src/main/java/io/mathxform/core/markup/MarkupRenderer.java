package io.mathxform.core.markup;

import io.mathxform.core.algebra.Expr;
import io.mathxform.core.model.RenderedMarkup;
import io.mathxform.core.spi.AlgebraEngine;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders replacement expressions in both markup dialects. Never throws.
 *
 * <p>
 * The engine's printers are tried first, with {@link PowerBaseGrouping} applied to the
 * presentation output. If the content printer fails, {@link FallbackMarkupPrinter} supplies the
 * content markup, and the same goes for the presentation printer and the grouping pass. The
 * fallback shows anything it does not cover as an {@code <mtext>} of the plain-text form.
 */
public final class MarkupRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(MarkupRenderer.class);

    private final AlgebraEngine engine;
    private final FallbackMarkupPrinter fallback;
    private final PowerBaseGrouping grouping;

    public MarkupRenderer(AlgebraEngine engine) {
        this(engine, new FallbackMarkupPrinter(), new PowerBaseGrouping());
    }

    MarkupRenderer(AlgebraEngine engine, FallbackMarkupPrinter fallback, PowerBaseGrouping grouping) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.fallback = fallback;
        this.grouping = grouping;
    }

    public RenderedMarkup render(Expr expr) {
        String content;
        try {
            content = engine.printContent(expr);
        } catch (RuntimeException e) {
            LOG.debug("Content printer failed for {}, using fallback: {}", expr, e.getMessage());
            content = fallback.content(expr);
        }
        String presentation;
        try {
            presentation = grouping.apply(engine.printPresentation(expr));
        } catch (RuntimeException e) {
            LOG.debug("Presentation printer failed for {}, using fallback: {}", expr, e.getMessage());
            presentation = fallback.presentation(expr);
        }
        return new RenderedMarkup(content, presentation);
    }
}
