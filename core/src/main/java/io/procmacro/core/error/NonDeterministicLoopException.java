package io.procmacro.core.error;

/**
 * Thrown when a range-loop bound does not resolve to a finite compile-time integer.
 */
public final class NonDeterministicLoopException extends ExpansionException {

    private static final long serialVersionUID = 1L;

    private final String indexVariable;

    public NonDeterministicLoopException(String indexVariable, String reason) {
        super("loop over '" + indexVariable + "' is not compile-time deterministic: " + reason,
                ErrorKind.NON_DETERMINISTIC_LOOP);
        this.indexVariable = indexVariable;
    }

    public String indexVariable() {
        return indexVariable;
    }
}
