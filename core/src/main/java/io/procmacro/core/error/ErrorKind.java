package io.procmacro.core.error;

/**
 * Closed taxonomy of compile errors. The {@link #label()} is the stable name that appears in compile
 * reports and audit logs.
 */
public enum ErrorKind {
    PARSE_ERROR("ParseError"),
    UNDEFINED_VARIABLE("UndefinedVariableError"),
    TYPE_ERROR("TypeError"),
    EVALUATION_ERROR("EvaluationError"),
    NON_DETERMINISTIC_LOOP("NonDeterministicLoopError"),
    MISSING_ROW_KEY("MissingRowKeyError"),
    DUPLICATE_ALLOCATION("DuplicateAllocationError"),
    ALLOCATION_OVERLAP("AllocationOverlapError"),
    DUPLICATE_MEASUREMENT_ID("DuplicateMeasurementIdError"),
    ORPHAN_EXPECTED_ID("OrphanExpectedIdError"),
    EXPANSION_LIMIT_EXCEEDED("ExpansionLimitExceededError");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    /** Report label, e.g. {@code "AllocationOverlapError"}. */
    public String label() {
        return label;
    }
}
