package io.procmacro.core.engine;

/**
 * Bounds on expansion work. Exceeding any of them aborts the compile with
 * {@link io.procmacro.core.error.ExpansionLimitExceededException}.
 *
 * <p>Immutable and thread-safe.
 *
 * @param maxSteps          maximum number of expanded steps (default: 100 000)
 * @param maxLoopIterations maximum loop iterations summed over all loops (default: 1 000 000)
 * @param maxNestingDepth   maximum depth of nested {@code @FOR}/{@code @IF} blocks (default: 64)
 */
public record CompileLimits(int maxSteps, long maxLoopIterations, int maxNestingDepth) {

    /** Default limits: 100 000 steps, 1 000 000 iterations, depth 64. */
    public static final CompileLimits DEFAULT = new CompileLimits(100_000, 1_000_000L, 64);

    public CompileLimits {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive, got: " + maxSteps);
        }
        if (maxLoopIterations <= 0) {
            throw new IllegalArgumentException("maxLoopIterations must be positive, got: " + maxLoopIterations);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
    }
}
