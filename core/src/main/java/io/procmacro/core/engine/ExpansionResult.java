package io.procmacro.core.engine;

import io.procmacro.core.model.Allocation;
import io.procmacro.core.model.CompileError;
import io.procmacro.core.model.ExpandedStep;
import java.util.List;

/**
 * Draft output of one expansion pass, handed to the {@link Validator}.
 *
 * @param steps       expanded steps in visit order
 * @param allocations successful allocations in declaration order
 * @param ownership   for every action step, the allocations its ID was computed from
 * @param errors      errors collected during expansion, in occurrence order
 * @param aborted     {@code true} when an expansion limit stopped the pass
 */
public record ExpansionResult(
        List<ExpandedStep> steps,
        List<Allocation> allocations,
        List<IdOwnership> ownership,
        List<CompileError> errors,
        boolean aborted) {

    public ExpansionResult {
        steps = List.copyOf(steps);
        allocations = List.copyOf(allocations);
        ownership = List.copyOf(ownership);
        errors = List.copyOf(errors);
    }

    /**
     * Which allocations a produced ID was computed from.
     *
     * @param position    position of the action step
     * @param id          the produced ID
     * @param line        authored line of the step
     * @param allocations allocations the ID was computed from, directly or through {@code @LET} and range
     *                    bindings, in first-use order; empty for a literal ID
     */
    public record IdOwnership(int position, long id, int line, List<String> allocations) {
        public IdOwnership {
            allocations = List.copyOf(allocations);
        }
    }
}
