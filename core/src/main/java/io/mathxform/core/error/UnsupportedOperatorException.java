package io.mathxform.core.error;

/** Thrown when markup uses a tag or an operator/arity combination the bridge does not support. */
public final class UnsupportedOperatorException extends MarkupParseException {

    private static final long serialVersionUID = 1L;

    private final String operator;

    public UnsupportedOperatorException(String message, String operator) {
        super(message);
        this.operator = operator;
    }

    /** The tag or operator name that was rejected. */
    public String operator() {
        return operator;
    }
}
