package io.procmacro.core.error;

import java.util.List;

/**
 * Thrown when an operator, marker or directive receives operands of the wrong type, e.g. {@code
 * "A" + 1} or a non-integer measurement ID.
 */
public final class ExpressionTypeException extends ExpansionException {

    private static final long serialVersionUID = 1L;

    private final String operator;
    private final List<String> operandTypes;

    public ExpressionTypeException(String operator, List<String> operandTypes) {
        super("operator '" + operator + "' not applicable to " + operandTypes, ErrorKind.TYPE_ERROR);
        this.operator = operator;
        this.operandTypes = List.copyOf(operandTypes);
    }

    /** The operator (or context such as {@code "{id}"}) that rejected its operands. */
    public String operator() {
        return operator;
    }

    /** Type names of the offending operands, in operand order. */
    public List<String> operandTypes() {
        return operandTypes;
    }
}
