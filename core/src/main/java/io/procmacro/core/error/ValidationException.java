package io.procmacro.core.error;

/**
 * Abstract parent for global-invariant violations found by the validator after expansion. Carries
 * the 0-based position of the offending step in the expanded procedure.
 */
public abstract class ValidationException extends ProcedureCompileException {

    private static final long serialVersionUID = 1L;

    private final int position;

    protected ValidationException(String message, ErrorKind kind, int line, int position) {
        super(message, kind, Phase.VALIDATION, line);
        this.position = position;
    }

    /** Position of the (first) offending step in the expanded procedure. */
    public int position() {
        return position;
    }
}
