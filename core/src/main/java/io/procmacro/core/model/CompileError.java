package io.procmacro.core.model;

import io.procmacro.core.error.DirectiveParseException;
import io.procmacro.core.error.ErrorKind;
import io.procmacro.core.error.ProcedureCompileException;
import io.procmacro.core.error.ValidationException;
import java.util.Objects;

/**
 * One entry of a failed compile report: {@code (kind, line, position, message)}.
 *
 * <p>Record equality over all four components is the deduplication key: the expander reports an
 * error raised again by a later loop iteration only when one of them differs. A component added
 * here becomes part of that key, so it must not vary between otherwise identical errors.
 *
 * @param kind     taxonomy entry
 * @param line     1-based authored line, or 0 when the error has no single source line
 * @param position 0-based expanded-step position for validation errors, otherwise {@code null}
 * @param message  human-readable description
 */
public record CompileError(ErrorKind kind, int line, Integer position, String message) {

    public CompileError {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /**
     * Converts an exception into a report entry. The exception's own line wins; {@code fallbackLine}
     * is the line of the node that was being expanded when it was raised.
     */
    public static CompileError from(ProcedureCompileException e, int fallbackLine) {
        int line = e.line() != null ? e.line() : fallbackLine;
        Integer position = e instanceof ValidationException v ? v.position() : null;
        String message = e instanceof DirectiveParseException p ? p.reason() : e.getMessage();
        return new CompileError(e.kind(), line, position, message);
    }

    @Override
    public String toString() {
        String where = position != null ? "line " + line + ", step " + position : "line " + line;
        return kind.label() + " (" + where + "): " + message;
    }
}
