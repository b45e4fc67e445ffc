package io.procmacro.core.spi;

import io.procmacro.core.model.CompileError;
import io.procmacro.core.model.IdRange;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SPI for audit and observability hooks on compile outcomes.
 *
 * <p>All methods receive immutable event objects. Implementations must be thread-safe when one
 * compiler is shared across threads. Exceptions thrown by listeners are caught by the compiler and
 * logged; they do not affect the compile report.
 */
public interface CompileListener {

    /**
     * Called after a procedure compiled successfully.
     *
     * @param event contains source, step count, allocation audit, digest and duration
     */
    void onCompileSucceeded(CompileSucceededEvent event);

    /**
     * Called after a procedure was rejected (parse, expansion or validation errors).
     *
     * @param event contains source, the ordered errors and duration
     */
    void onCompileFailed(CompileFailedEvent event);

    // --- Event records ---

    /** Emitted when a compile succeeds. */
    record CompileSucceededEvent(
            String source, int steps, Map<String, IdRange> allocations, String sha256, long durationMs) {
        public CompileSucceededEvent {
            allocations = Collections.unmodifiableMap(new LinkedHashMap<>(allocations));
        }
    }

    /** Emitted when a compile fails. */
    record CompileFailedEvent(String source, List<CompileError> errors, long durationMs) {
        public CompileFailedEvent {
            errors = List.copyOf(errors);
        }
    }
}
