package io.procmacro.core.model;

import java.util.Objects;

/**
 * A named measurement-ID range reserved by {@code @ALLOC}. Immutable once created.
 *
 * @param name  unique allocation name
 * @param range reserved IDs
 * @param auto  {@code true} when placed by the allocator cursor, {@code false} for
 *              {@code START=}/{@code COUNT=} allocations
 * @param line  line of the {@code @ALLOC} directive
 */
public record Allocation(String name, IdRange range, boolean auto, int line) {

    public Allocation {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(range, "range must not be null");
    }
}
