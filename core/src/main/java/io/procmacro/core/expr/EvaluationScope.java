package io.procmacro.core.expr;

import io.procmacro.core.model.Value;

/**
 * Symbol source for the {@link Evaluator}. Implemented by the expansion engine's symbol table.
 */
public interface EvaluationScope {

    /**
     * Resolves a bare symbol.
     *
     * @throws io.procmacro.core.error.UndefinedVariableException when the name is not bound
     */
    Value lookup(String name);

    /**
     * Resolves {@code name.member}: a row cell for a row variable, or {@code start}/{@code count}/
     * {@code end} for an allocation.
     */
    Value lookupMember(String name, String member);

    /** Number of rows in a table, for {@code COUNT(table)}. */
    long rowCount(String table);
}
