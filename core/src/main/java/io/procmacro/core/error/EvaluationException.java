package io.procmacro.core.error;

/** Thrown when a well-typed expression cannot produce a value (division by zero, overflow, etc.). */
public final class EvaluationException extends ExpansionException {

    private static final long serialVersionUID = 1L;

    public static final String DIVISION_BY_ZERO = "division by zero";

    private final String reason;

    public EvaluationException(String reason) {
        super(reason, ErrorKind.EVALUATION_ERROR);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
