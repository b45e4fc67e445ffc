package io.procmacro.core.engine;

/**
 * Raised when an expression reads a symbol whose definition already failed. The expander skips the
 * node without reporting, so that one root cause yields one error.
 */
final class SuppressedReferenceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String name;

    SuppressedReferenceException(String name) {
        super("reference to failed definition '" + name + "'", null, false, false);
        this.name = name;
    }

    String name() {
        return name;
    }
}
