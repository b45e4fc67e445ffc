package io.procmacro.core.parse;

/**
 * Internal signal for a malformed expression. {@link ExpressionParser} converts it into a
 * {@link io.procmacro.core.error.DirectiveParseException} carrying the authored line.
 */
final class ExpressionSyntaxError extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int column;

    ExpressionSyntaxError(String message, int column) {
        super(message);
        this.column = column;
    }

    int column() {
        return column;
    }
}
