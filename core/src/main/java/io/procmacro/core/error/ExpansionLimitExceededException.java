package io.procmacro.core.error;

/**
 * Thrown when expansion work exceeds a configured limit. Unlike other expansion errors this one is
 * fatal: expansion stops immediately.
 */
public final class ExpansionLimitExceededException extends ExpansionException {

    private static final long serialVersionUID = 1L;

    private final String limit;
    private final long maximum;

    public ExpansionLimitExceededException(String limit, long maximum) {
        super("expansion exceeded " + limit + " limit of " + maximum, ErrorKind.EXPANSION_LIMIT_EXCEEDED);
        this.limit = limit;
        this.maximum = maximum;
    }

    /** Limit name, e.g. {@code "max-steps"}. */
    public String limit() {
        return limit;
    }

    public long maximum() {
        return maximum;
    }
}
