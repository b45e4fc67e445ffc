package io.procmacro.core.model;

import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

/**
 * Half-open range of measurement IDs {@code [start, start + count)}.
 *
 * <p>Immutable and thread-safe.
 *
 * @param start first ID in the range (non-negative)
 * @param count number of IDs (non-negative; zero is an empty range)
 */
public record IdRange(long start, long count) {

    /** Above this size {@link #describeIds()} abbreviates to {@code first..last}. */
    private static final int MAX_LISTED_IDS = 8;

    public IdRange {
        if (start < 0) {
            throw new IllegalArgumentException("start must be non-negative, got: " + start);
        }
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative, got: " + count);
        }
    }

    /** Single-ID range {@code [id, id + 1)}. */
    public static IdRange single(long id) {
        return new IdRange(id, 1);
    }

    /** Exclusive end of the range. */
    public long end() {
        return start + count;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    public boolean contains(long id) {
        return id >= start && id < end();
    }

    /**
     * Returns the intersection with {@code other}, or empty if the ranges are disjoint (an empty
     * range intersects nothing).
     */
    public Optional<IdRange> intersect(IdRange other) {
        long lo = Math.max(start, other.start);
        long hi = Math.min(end(), other.end());
        return lo < hi ? Optional.of(new IdRange(lo, hi - lo)) : Optional.empty();
    }

    /** Comma-separated IDs for small ranges ({@code "3,4"}), {@code "first..last"} otherwise. */
    public String describeIds() {
        if (count <= MAX_LISTED_IDS) {
            return LongStream.range(start, end()).mapToObj(Long::toString).collect(Collectors.joining(","));
        }
        return start + ".." + (end() - 1);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end() + ")";
    }
}
