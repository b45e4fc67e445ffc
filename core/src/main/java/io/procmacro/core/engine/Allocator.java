package io.procmacro.core.engine;

import io.procmacro.core.error.AllocationOverlapException;
import io.procmacro.core.error.DuplicateAllocationException;
import io.procmacro.core.error.EvaluationException;
import io.procmacro.core.model.Allocation;
import io.procmacro.core.model.IdRange;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reserves named, disjoint ID ranges.
 *
 * <p>Auto allocations start at an internal cursor that begins at 0 and advances past each auto
 * range. Manual allocations reserve exactly the requested range and leave the cursor alone. Every
 * new range is checked against every earlier one; the first intersection raises
 * {@link AllocationOverlapException} and the range is not recorded.
 *
 * <p>Not thread-safe: one instance per compile.
 */
final class Allocator {

    private final Map<String, Allocation> allocations = new LinkedHashMap<>();
    private final Set<String> failed = new HashSet<>();
    private long cursor;

    Allocation allocateAuto(String name, long count, int line) {
        requireNewName(name);
        requireNonNegative("count", count);
        if (count > Long.MAX_VALUE - cursor) {
            throw new EvaluationException("allocation '" + name + "' extends past the largest ID");
        }
        Allocation allocation = new Allocation(name, new IdRange(cursor, count), true, line);
        reserve(allocation);
        cursor = allocation.range().end();
        return allocation;
    }

    Allocation allocateManual(String name, long start, long count, int line) {
        requireNewName(name);
        requireNonNegative("start", start);
        requireNonNegative("count", count);
        if (start > Long.MAX_VALUE - count) {
            throw new EvaluationException("allocation '" + name + "' extends past the largest ID");
        }
        Allocation allocation = new Allocation(name, new IdRange(start, count), false, line);
        reserve(allocation);
        return allocation;
    }

    /** Marks a name whose {@code @ALLOC} failed, so later references are suppressed. */
    void markFailed(String name) {
        if (!allocations.containsKey(name)) {
            failed.add(name);
        }
    }

    boolean isFailed(String name) {
        return failed.contains(name);
    }

    Optional<Allocation> find(String name) {
        return Optional.ofNullable(allocations.get(name));
    }

    /** All successful allocations in declaration order. */
    List<Allocation> allocations() {
        return List.copyOf(allocations.values());
    }

    long cursor() {
        return cursor;
    }

    private void requireNewName(String name) {
        if (allocations.containsKey(name)) {
            throw new DuplicateAllocationException(name);
        }
        if (failed.contains(name)) {
            throw new SuppressedReferenceException(name);
        }
    }

    private static void requireNonNegative(String what, long value) {
        if (value < 0) {
            throw new EvaluationException("allocation " + what + " must not be negative, got " + value);
        }
    }

    private void reserve(Allocation candidate) {
        for (Allocation existing : allocations.values()) {
            Optional<IdRange> overlap = existing.range().intersect(candidate.range());
            if (overlap.isPresent()) {
                throw new AllocationOverlapException(
                        existing.name(), existing.range(), candidate.name(), candidate.range(), overlap.get());
            }
        }
        allocations.put(candidate.name(), candidate);
    }
}
