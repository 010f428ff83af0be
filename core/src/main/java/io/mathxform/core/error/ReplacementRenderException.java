package io.mathxform.core.error;

/**
 * Thrown by a markup printer that cannot serialize an expression. The renderer recovers through
 * its fallback printers, so callers of the suggestion service never see this exception.
 */
public final class ReplacementRenderException extends RewriteException {

    private static final long serialVersionUID = 1L;

    public ReplacementRenderException(String message) {
        super(message, Phase.RENDER);
    }

    public ReplacementRenderException(String message, Throwable cause) {
        super(message, cause, Phase.RENDER);
    }
}
