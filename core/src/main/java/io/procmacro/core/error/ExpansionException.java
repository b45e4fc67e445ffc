package io.procmacro.core.error;

/**
 * Abstract parent for semantic errors raised while the syntax tree is expanded (evaluation, scoping,
 * allocation, limits). The expander collects these instead of failing fast, except for
 * {@link ExpansionLimitExceededException}.
 */
public abstract class ExpansionException extends ProcedureCompileException {

    private static final long serialVersionUID = 1L;

    protected ExpansionException(String message, ErrorKind kind) {
        super(message, kind, Phase.EXPANSION, null);
    }
}
