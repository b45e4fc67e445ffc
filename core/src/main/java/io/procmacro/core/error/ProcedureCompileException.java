package io.procmacro.core.error;

/**
 * Abstract base for all procedure compile exceptions. Never thrown directly; use the concrete
 * subclasses under {@link DirectiveParseException}, {@link ExpansionException} or
 * {@link ValidationException}.
 */
public abstract class ProcedureCompileException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Pipeline phase in which the error occurred. */
    public enum Phase {
        PARSE,
        EXPANSION,
        VALIDATION
    }

    private final ErrorKind kind;
    private final Phase phase;
    private final Integer line;

    protected ProcedureCompileException(String message, ErrorKind kind, Phase phase, Integer line) {
        super(message);
        this.kind = kind;
        this.phase = phase;
        this.line = line;
    }

    /** The taxonomy entry this exception reports as. */
    public ErrorKind kind() {
        return kind;
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }

    /**
     * The 1-based source line, or {@code null} when the error was raised below the line level (the
     * expander attaches the line of the node being expanded).
     */
    public Integer line() {
        return line;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
