package io.mathxform.core.error;

/**
 * Raised for a single malformed rule line or an unreadable rule file. The catalog loader logs and
 * skips these; they never escape catalog loading.
 */
public final class RuleLoadException extends RewriteException {

    private static final long serialVersionUID = 1L;

    private final String source;
    private final int line;

    public RuleLoadException(String message, String source, int line) {
        super(message, Phase.LOAD);
        this.source = source;
        this.line = line;
    }

    public RuleLoadException(String message, Throwable cause, String source, int line) {
        super(message, cause, Phase.LOAD);
        this.source = source;
        this.line = line;
    }

    /** The file path or resource name that caused the error. */
    public String source() {
        return source;
    }

    /** 1-based line number, or {@code 0} when the whole source failed. */
    public int line() {
        return line;
    }
}
