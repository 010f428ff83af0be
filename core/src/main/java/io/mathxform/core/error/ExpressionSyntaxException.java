package io.mathxform.core.error;

/** Thrown by the algebra engine when a rule side is not a well-formed infix expression. */
public final class ExpressionSyntaxException extends RewriteException {

    private static final long serialVersionUID = 1L;

    private final int position;

    public ExpressionSyntaxException(String message, int position) {
        super(message, Phase.LOAD);
        this.position = position;
    }

    /** 0-based character offset at which parsing stopped. */
    public int position() {
        return position;
    }
}
