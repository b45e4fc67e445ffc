package io.procmacro.core.error;

/**
 * Thrown when a JSON or YAML procedure document cannot be read or does not match the document
 * schema. Raised before compilation starts, so it is not part of a compile report.
 */
public class ProcedureDocumentException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public ProcedureDocumentException(String message, String source) {
        super(message);
        this.source = source;
    }

    public ProcedureDocumentException(String message, Throwable cause, String source) {
        super(message, cause);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
