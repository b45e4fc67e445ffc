package io.procmacro.core.error;

import io.procmacro.core.model.IdRange;

/**
 * Thrown when two ID ranges intersect: two allocations, or an allocation and a measurement ID that
 * does not belong to it. Raised eagerly by the allocator and again by the validator cross-check.
 */
public final class AllocationOverlapException extends ExpansionException {

    private static final long serialVersionUID = 1L;

    private final String nameA;
    private final IdRange rangeA;
    private final String nameB;
    private final IdRange rangeB;
    private final IdRange intersection;

    public AllocationOverlapException(
            String nameA, IdRange rangeA, String nameB, IdRange rangeB, IdRange intersection) {
        this(
                "'" + nameB + "' " + rangeB + " overlaps '" + nameA + "' " + rangeA + " at IDs "
                        + intersection.describeIds(),
                nameA,
                rangeA,
                nameB,
                rangeB,
                intersection);
    }

    private AllocationOverlapException(
            String message, String nameA, IdRange rangeA, String nameB, IdRange rangeB, IdRange intersection) {
        super(message, ErrorKind.ALLOCATION_OVERLAP);
        this.nameA = nameA;
        this.rangeA = rangeA;
        this.nameB = nameB;
        this.rangeB = rangeB;
        this.intersection = intersection;
    }

    /**
     * An ID computed from allocation {@code owner} that falls outside it. The intersection is the
     * empty range at {@code id}.
     */
    public static AllocationOverlapException outsideOwner(String owner, IdRange ownerRange, String stepName, long id) {
        IdRange single = IdRange.single(id);
        return new AllocationOverlapException(
                "'" + stepName + "' ID " + id + " lies outside its allocation '" + owner + "' " + ownerRange,
                owner,
                ownerRange,
                stepName,
                single,
                new IdRange(id, 0));
    }

    /** The earlier range's owner. */
    public String nameA() {
        return nameA;
    }

    public IdRange rangeA() {
        return rangeA;
    }

    /** The later (offending) range's owner. */
    public String nameB() {
        return nameB;
    }

    public IdRange rangeB() {
        return rangeB;
    }

    /** The intersection of both ranges; empty only for {@link #outsideOwner}. */
    public IdRange intersection() {
        return intersection;
    }
}
