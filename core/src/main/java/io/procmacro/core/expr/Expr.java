package io.procmacro.core.expr;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Expression tree of the macro language. A closed variant: the parser produces only these records
 * and {@link Evaluator} handles each through {@link Visitor}, so adding a node kind is a compile
 * error until every visitor covers it.
 *
 * <p>Thread-safe and immutable.
 */
public sealed interface Expr {

    <R> R accept(Visitor<R> visitor);

    /**
     * Names of every symbol referenced by the expression, in first-occurrence order. Table names
     * inside {@code COUNT(...)} are not symbols and are excluded.
     */
    static Set<String> symbols(Expr expr) {
        Set<String> names = new LinkedHashSet<>();
        expr.accept(new Visitor<Void>() {
            @Override
            public Void visitInt(IntLiteral e) {
                return null;
            }

            @Override
            public Void visitReal(RealLiteral e) {
                return null;
            }

            @Override
            public Void visitBool(BoolLiteral e) {
                return null;
            }

            @Override
            public Void visitStr(StrLiteral e) {
                return null;
            }

            @Override
            public Void visitSymbol(SymbolRef e) {
                names.add(e.name());
                return null;
            }

            @Override
            public Void visitCount(CountCall e) {
                return null;
            }

            @Override
            public Void visitUnary(Unary e) {
                return e.operand().accept(this);
            }

            @Override
            public Void visitBinary(Binary e) {
                e.left().accept(this);
                return e.right().accept(this);
            }
        });
        return names;
    }

    /** One method per variant. */
    interface Visitor<R> {
        R visitInt(IntLiteral e);

        R visitReal(RealLiteral e);

        R visitBool(BoolLiteral e);

        R visitStr(StrLiteral e);

        R visitSymbol(SymbolRef e);

        R visitCount(CountCall e);

        R visitUnary(Unary e);

        R visitBinary(Binary e);
    }

    enum UnaryOp {
        NOT("NOT"),
        NEGATE("-");

        private final String symbol;

        UnaryOp(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    enum BinaryOp {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        REMAINDER("%"),
        EQ("=="),
        NE("!="),
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">="),
        AND("AND"),
        OR("OR");

        private final String symbol;

        BinaryOp(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isArithmetic() {
            return ordinal() <= REMAINDER.ordinal();
        }

        public boolean isComparison() {
            return ordinal() >= EQ.ordinal() && ordinal() <= GE.ordinal();
        }
    }

    // ── Variants ──

    record IntLiteral(long value) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInt(this);
        }
    }

    record RealLiteral(double value) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReal(this);
        }
    }

    record BoolLiteral(boolean value) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBool(this);
        }
    }

    record StrLiteral(String value) implements Expr {
        public StrLiteral {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStr(this);
        }
    }

    /**
     * Symbol reference, optionally with member access ({@code row.key}, {@code BASE.count}).
     *
     * @param name   symbol name
     * @param member member key, or {@code null} for a plain reference
     */
    record SymbolRef(String name, String member) implements Expr {
        public SymbolRef {
            Objects.requireNonNull(name, "name must not be null");
        }

        public boolean hasMember() {
            return member != null;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSymbol(this);
        }
    }

    /** {@code COUNT(table)}, the only function in the language. */
    record CountCall(String table) implements Expr {
        public CountCall {
            Objects.requireNonNull(table, "table must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCount(this);
        }
    }

    record Unary(UnaryOp op, Expr operand) implements Expr {
        public Unary {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnary(this);
        }
    }

    record Binary(BinaryOp op, Expr left, Expr right) implements Expr {
        public Binary {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }
}
