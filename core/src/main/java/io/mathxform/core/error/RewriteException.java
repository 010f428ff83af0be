package io.mathxform.core.error;

/**
 * Abstract base for all math-xform exceptions. Never thrown directly; use one of the concrete
 * subclasses, each of which is tied to the {@link Phase} it can occur in.
 */
public abstract class RewriteException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        /** Rule catalog loading at process start. */
        LOAD,
        /** Handling of a caller's suggestion request. */
        REQUEST,
        /** Serialization of a replacement expression to markup. */
        RENDER
    }

    private final Phase phase;

    protected RewriteException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected RewriteException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
