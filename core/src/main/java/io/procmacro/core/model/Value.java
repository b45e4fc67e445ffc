package io.procmacro.core.model;

import io.procmacro.core.error.ExpressionTypeException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Compile-time value. A closed variant: every value a macro can observe is one of these records, and
 * row cells are typed once when the table is parsed.
 *
 * <p>Thread-safe and immutable.
 */
public sealed interface Value {

    /** Type name used in error messages, e.g. {@code "Int"}. */
    String typeName();

    /**
     * Canonical textual form substituted into steps.
     *
     * @throws ExpressionTypeException for values that have no textual form (rows)
     */
    String render();

    default boolean isNumeric() {
        return this instanceof Int || this instanceof Real;
    }

    /** Str and Ident compare as strings. */
    default boolean isText() {
        return this instanceof Str || this instanceof Ident;
    }

    static Value of(long value) {
        return new Int(value);
    }

    static Value of(double value) {
        return new Real(value);
    }

    static Value of(boolean value) {
        return value ? Bool.TRUE : Bool.FALSE;
    }

    static Value of(String value) {
        return new Str(value);
    }

    // ── Variants ──

    /** 64-bit integer. */
    record Int(long value) implements Value {
        @Override
        public String typeName() {
            return "Int";
        }

        @Override
        public String render() {
            return Long.toString(value);
        }
    }

    /** Finite double. */
    record Real(double value) implements Value {
        @Override
        public String typeName() {
            return "Real";
        }

        /** Plain decimal, no exponent, no trailing zeros, always with a fraction: {@code 2.0}, {@code 0.0001}. */
        @Override
        public String render() {
            BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
            String plain = decimal.toPlainString();
            return decimal.scale() <= 0 ? plain + ".0" : plain;
        }
    }

    record Bool(boolean value) implements Value {
        static final Bool TRUE = new Bool(true);
        static final Bool FALSE = new Bool(false);

        @Override
        public String typeName() {
            return "Bool";
        }

        @Override
        public String render() {
            return Boolean.toString(value);
        }
    }

    /** Quoted string. */
    record Str(String value) implements Value {
        public Str {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String typeName() {
            return "Str";
        }

        @Override
        public String render() {
            return value;
        }
    }

    /** Bare token from a {@code @ROW} cell, e.g. {@code io=CH1}. */
    record Ident(String name) implements Value {
        public Ident {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String typeName() {
            return "Ident";
        }

        @Override
        public String render() {
            return name;
        }
    }

    /**
     * A table row bound to a loop variable. Members are read with {@code row.key}.
     *
     * @param table owning table name
     * @param index zero-based row index
     * @param row   the row cells
     */
    record RowRef(String table, int index, Row row) implements Value {
        public RowRef {
            Objects.requireNonNull(table, "table must not be null");
            Objects.requireNonNull(row, "row must not be null");
        }

        @Override
        public String typeName() {
            return "Row";
        }

        @Override
        public String render() {
            throw new ExpressionTypeException("${}", List.of(typeName()));
        }
    }
}
