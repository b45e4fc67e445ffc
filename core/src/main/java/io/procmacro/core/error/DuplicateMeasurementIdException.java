package io.procmacro.core.error;

import java.util.List;

/** Reported when more than one action step produces the same measurement ID. */
public final class DuplicateMeasurementIdException extends ValidationException {

    private static final long serialVersionUID = 1L;

    private final long id;
    private final List<Integer> positions;

    /**
     * @param positions every position producing {@code id}, ascending; the reported position is the
     *                  first repeat
     * @param line      authored line of the first repeat
     */
    public DuplicateMeasurementIdException(long id, List<Integer> positions, int line) {
        super("measurement ID " + id + " is produced by steps at positions " + positions,
                ErrorKind.DUPLICATE_MEASUREMENT_ID, line, positions.get(positions.size() > 1 ? 1 : 0));
        this.id = id;
        this.positions = List.copyOf(positions);
    }

    public long id() {
        return id;
    }

    /** Positions of every step producing {@link #id()}, ascending. */
    public List<Integer> positions() {
        return positions;
    }
}
