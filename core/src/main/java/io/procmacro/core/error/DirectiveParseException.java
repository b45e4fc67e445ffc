package io.procmacro.core.error;

/**
 * Thrown when authored text is structurally malformed: unknown or malformed directives, unbalanced
 * blocks, bad {@code @ROW} cells, or expression syntax errors. Parse errors are fatal; an invalid
 * tree is never expanded.
 */
public final class DirectiveParseException extends ProcedureCompileException {

    private static final long serialVersionUID = 1L;

    private final String reason;

    public DirectiveParseException(String reason, int line) {
        super("line " + line + ": " + reason, ErrorKind.PARSE_ERROR, Phase.PARSE, line);
        this.reason = reason;
    }

    /** The reason without the line prefix. */
    public String reason() {
        return reason;
    }
}
