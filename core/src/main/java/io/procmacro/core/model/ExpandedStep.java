package io.procmacro.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One concrete, directive-free step of an expanded procedure.
 *
 * @param text          resolved text with every marker replaced
 * @param measurementId produced ID for {@link StepRole#ACTION}, first referenced ID for
 *                      {@link StepRole#EXPECTED}, {@code null} for {@link StepRole#TEXT}
 * @param role          action / expected / text
 * @param references    IDs referenced by non-leading markers, in line order
 * @param sourceLine    authored line the step was expanded from
 */
public record ExpandedStep(String text, Long measurementId, StepRole role, List<Long> references, int sourceLine) {

    public ExpandedStep {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(role, "role must not be null");
        references = List.copyOf(references);
        if (role == StepRole.TEXT && measurementId != null) {
            throw new IllegalArgumentException("TEXT steps carry no measurement ID");
        }
    }

    public boolean hasMeasurementId() {
        return measurementId != null;
    }
}
