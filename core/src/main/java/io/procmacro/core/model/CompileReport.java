package io.procmacro.core.model;

import io.procmacro.core.error.ProcedureCompileFailedException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of compiling one authored procedure. Exactly one of two states:
 *
 * <ul>
 * <li>{@link Type#SUCCESS}: {@code procedure} holds the expanded procedure, {@code allocations}
 * the allocation audit and {@code sha256} the digest of the rendered procedure; no errors.
 * <li>{@link Type#FAILURE}: {@code errors} holds every defect found, in report order; there is no
 * procedure and no allocation audit.
 * </ul>
 *
 * <p>Immutable.
 */
public final class CompileReport {

    /** The type of compile outcome. */
    public enum Type {
        SUCCESS,
        FAILURE
    }

    private final Type type;
    private final String source;
    private final ExpandedProcedure procedure;
    private final Map<String, IdRange> allocations;
    private final String sha256;
    private final List<CompileError> errors;

    private CompileReport(
            Type type,
            String source,
            ExpandedProcedure procedure,
            Map<String, IdRange> allocations,
            String sha256,
            List<CompileError> errors) {
        this.type = type;
        this.source = source;
        this.procedure = procedure;
        this.allocations = allocations;
        this.sha256 = sha256;
        this.errors = errors;
    }

    /** Creates a SUCCESS report; allocations keep their declaration order. */
    public static CompileReport success(
            String source, ExpandedProcedure procedure, List<Allocation> allocations, String sha256) {
        Objects.requireNonNull(procedure, "procedure must not be null for SUCCESS");
        Objects.requireNonNull(sha256, "sha256 must not be null for SUCCESS");
        Map<String, IdRange> audit = new LinkedHashMap<>();
        for (Allocation allocation : allocations) {
            audit.put(allocation.name(), allocation.range());
        }
        return new CompileReport(
                Type.SUCCESS, source, procedure, Collections.unmodifiableMap(audit), sha256, List.of());
    }

    /** Creates a FAILURE report. */
    public static CompileReport failure(String source, List<CompileError> errors) {
        Objects.requireNonNull(errors, "errors must not be null for FAILURE");
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("FAILURE requires at least one error");
        }
        return new CompileReport(Type.FAILURE, source, null, Map.of(), null, List.copyOf(errors));
    }

    public Type type() {
        return type;
    }

    /** Display name of the compiled input. */
    public String source() {
        return source;
    }

    /** The expanded procedure. Only valid when {@code type() == SUCCESS}. */
    public ExpandedProcedure procedure() {
        return procedure;
    }

    /** Allocation audit {@code name -> [start, end)}. Empty on FAILURE. */
    public Map<String, IdRange> allocations() {
        return allocations;
    }

    /** Hex SHA-256 of {@link ExpandedProcedure#render()}. Only valid when SUCCESS. */
    public String sha256() {
        return sha256;
    }

    /** Errors in report order. Empty on SUCCESS. */
    public List<CompileError> errors() {
        return errors;
    }

    public boolean isSuccess() {
        return type == Type.SUCCESS;
    }

    public boolean isFailure() {
        return type == Type.FAILURE;
    }

    /**
     * Returns the expanded procedure, or throws with the full error list.
     *
     * @throws ProcedureCompileFailedException if the compile failed
     */
    public ExpandedProcedure orElseThrow() {
        if (isFailure()) {
            throw new ProcedureCompileFailedException(source, errors);
        }
        return procedure;
    }

    @Override
    public String toString() {
        return switch (type) {
            case SUCCESS -> "CompileReport[SUCCESS, source=" + source + ", steps=" + procedure.size()
                    + ", allocations=" + allocations.size() + "]";
            case FAILURE -> "CompileReport[FAILURE, source=" + source + ", errors=" + errors.size() + "]";
        };
    }
}
