package io.procmacro.core.error;

import io.procmacro.core.model.CompileError;
import java.util.List;

/**
 * Thrown by {@code CompileReport.orElseThrow()} when a caller asks for the expanded procedure of a
 * failed compile. Carries the complete error list.
 */
public class ProcedureCompileFailedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient List<CompileError> errors;

    public ProcedureCompileFailedException(String source, List<CompileError> errors) {
        super("Compilation of '" + source + "' failed with " + errors.size() + " error(s); first: "
                + (errors.isEmpty() ? "none" : errors.get(0)));
        this.errors = List.copyOf(errors);
    }

    public List<CompileError> errors() {
        return errors;
    }
}
