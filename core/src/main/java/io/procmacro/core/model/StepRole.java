package io.procmacro.core.model;

/** Role of an expanded step, decided by where its ID markers sit in the authored line. */
public enum StepRole {
    /** Leading {@code {id}} marker: the step produces a measurement. */
    ACTION,
    /** Non-leading markers only: the step checks measurements produced earlier. */
    EXPECTED,
    /** No ID markers. */
    TEXT
}
