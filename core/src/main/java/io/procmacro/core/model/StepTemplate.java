package io.procmacro.core.model;

import io.procmacro.core.expr.Expr;
import java.util.List;
import java.util.Objects;

/**
 * A literal step line split into literal text and unevaluated markers.
 *
 * @param source   the authored line
 * @param segments literal text, {@code ${expr}} substitutions and {@code {expr}} ID markers, in
 *                 line order
 */
public record StepTemplate(String source, List<Segment> segments) {

    public StepTemplate {
        Objects.requireNonNull(source, "source must not be null");
        segments = List.copyOf(segments);
    }

    /** {@code true} if the line opens with an ID marker, making it an action line. */
    public boolean hasLeadingId() {
        return segments.stream().anyMatch(s -> s instanceof IdMarker m && m.leading());
    }

    public boolean hasIdMarkers() {
        return segments.stream().anyMatch(s -> s instanceof IdMarker);
    }

    public sealed interface Segment {}

    /** Text copied verbatim (brace escapes already resolved). */
    public record Literal(String text) implements Segment {}

    /** {@code ${expr}}: replaced by the canonical text of the value. */
    public record Substitution(Expr expr, String source) implements Segment {}

    /**
     * {@code {expr}}: replaced by a measurement ID.
     *
     * @param leading {@code true} when the marker is the first thing on the line
     */
    public record IdMarker(Expr expr, String source, boolean leading) implements Segment {}
}
