package io.mathxform.core.error;

/**
 * Thrown when a caller-supplied Content MathML fragment is malformed or uses an operator outside
 * the supported vocabulary. Surfaced to the caller as a request rejection carrying the message.
 */
public class MarkupParseException extends RewriteException {

    private static final long serialVersionUID = 1L;

    public MarkupParseException(String message) {
        super(message, Phase.REQUEST);
    }

    public MarkupParseException(String message, Throwable cause) {
        super(message, cause, Phase.REQUEST);
    }
}
