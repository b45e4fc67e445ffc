package io.procmacro.core.error;

/**
 * Reported when a step references a measurement ID that no earlier action step produced.
 */
public final class OrphanExpectedIdException extends ValidationException {

    private static final long serialVersionUID = 1L;

    private final long id;

    public OrphanExpectedIdException(long id, int position, int line) {
        super("step at position " + position + " references measurement ID " + id
                + " which no earlier action step produces", ErrorKind.ORPHAN_EXPECTED_ID, line, position);
        this.id = id;
    }

    public long id() {
        return id;
    }
}
