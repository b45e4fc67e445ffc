package io.procmacro.core.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered, immutable sequence of expanded steps: the sole output artifact of a successful compile.
 */
public final class ExpandedProcedure {

    private final List<ExpandedStep> steps;

    public ExpandedProcedure(List<ExpandedStep> steps) {
        this.steps = List.copyOf(steps);
    }

    public List<ExpandedStep> steps() {
        return steps;
    }

    public int size() {
        return steps.size();
    }

    public ExpandedStep step(int position) {
        return steps.get(position);
    }

    /** Step texts in order. */
    public List<String> lines() {
        return steps.stream().map(ExpandedStep::text).collect(Collectors.toUnmodifiableList());
    }

    /** Step texts joined with {@code \n}; byte-identical across compiles of identical input. */
    public String render() {
        return String.join("\n", lines());
    }

    /** IDs produced by action steps, in step order. */
    public List<Long> actionIds() {
        return steps.stream()
                .filter(s -> s.role() == StepRole.ACTION)
                .map(ExpandedStep::measurementId)
                .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ExpandedProcedure other && steps.equals(other.steps);
    }

    @Override
    public int hashCode() {
        return steps.hashCode();
    }

    @Override
    public String toString() {
        return "ExpandedProcedure[steps=" + steps.size() + "]";
    }
}
