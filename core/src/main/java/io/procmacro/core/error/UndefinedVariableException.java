package io.procmacro.core.error;

/** Thrown when a symbol or table reference cannot be resolved in the current scope. */
public final class UndefinedVariableException extends ExpansionException {

    private static final long serialVersionUID = 1L;

    private final String name;

    public UndefinedVariableException(String name) {
        super("undefined variable '" + name + "'", ErrorKind.UNDEFINED_VARIABLE);
        this.name = name;
    }

    public UndefinedVariableException(String name, String what) {
        super("undefined " + what + " '" + name + "'", ErrorKind.UNDEFINED_VARIABLE);
        this.name = name;
    }

    /** The unresolved symbol or table name. */
    public String name() {
        return name;
    }
}
