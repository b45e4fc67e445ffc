package io.procmacro.core.config;

import io.procmacro.core.engine.CompileLimits;
import java.util.Objects;

/**
 * Compiler configuration.
 *
 * <p>Use {@link #builder()} to construct instances; unset fields take the defaults shown below.
 *
 * @param maxSteps          maximum expanded steps ({@code limits.max-steps}, default 100 000)
 * @param maxLoopIterations maximum total loop iterations ({@code limits.max-loop-iterations},
 *                          default 1 000 000)
 * @param maxNestingDepth   maximum block nesting depth ({@code limits.max-nesting-depth}, default 64)
 * @param procedureField    document field holding the authored procedure
 *                          ({@code documents.procedure-field}, default {@code procedure})
 */
public record CompilerConfig(int maxSteps, long maxLoopIterations, int maxNestingDepth, String procedureField) {

    /** All defaults. */
    public static final CompilerConfig DEFAULT = builder().build();

    public CompilerConfig {
        Objects.requireNonNull(procedureField, "procedureField must not be null");
        if (procedureField.isBlank()) {
            throw new IllegalArgumentException("procedureField must not be blank");
        }
        // validates the numeric limits
        new CompileLimits(maxSteps, maxLoopIterations, maxNestingDepth);
    }

    /** The expansion limits as a {@link CompileLimits}. */
    public CompileLimits limits() {
        return new CompileLimits(maxSteps, maxLoopIterations, maxNestingDepth);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxSteps = CompileLimits.DEFAULT.maxSteps();
        private long maxLoopIterations = CompileLimits.DEFAULT.maxLoopIterations();
        private int maxNestingDepth = CompileLimits.DEFAULT.maxNestingDepth();
        private String procedureField = "procedure";

        Builder() {}

        public Builder maxSteps(int maxSteps) {
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder maxLoopIterations(long maxLoopIterations) {
            this.maxLoopIterations = maxLoopIterations;
            return this;
        }

        public Builder maxNestingDepth(int maxNestingDepth) {
            this.maxNestingDepth = maxNestingDepth;
            return this;
        }

        public Builder procedureField(String procedureField) {
            this.procedureField = procedureField;
            return this;
        }

        public CompilerConfig build() {
            return new CompilerConfig(maxSteps, maxLoopIterations, maxNestingDepth, procedureField);
        }
    }
}
