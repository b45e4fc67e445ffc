package io.procmacro.core.model;

import io.procmacro.core.expr.Expr;
import java.util.List;
import java.util.Objects;

/**
 * Node of the parsed procedure tree. A closed variant mirroring authored block nesting; immutable
 * once parsed. Expansion dispatches through {@link Visitor}, one method per directive.
 */
public sealed interface SyntaxNode {

    /** 1-based line of the authored line or opening directive. */
    int line();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitStep(Step node);

        R visitLet(LetBind node);

        R visitTable(TableDef node);

        R visitAlloc(Alloc node);

        R visitForTable(ForTable node);

        R visitForRange(ForRange node);

        R visitIf(If node);
    }

    /** Literal step line. */
    record Step(int line, StepTemplate template) implements SyntaxNode {
        public Step {
            Objects.requireNonNull(template, "template must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStep(this);
        }
    }

    /** {@code @LET name = expr}. */
    record LetBind(int line, String name, Expr expr) implements SyntaxNode {
        public LetBind {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(expr, "expr must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLet(this);
        }
    }

    /**
     * {@code @TABLE name ... @ENDTABLE}. The rows live in the parsed procedure's table store; the node
     * marks where the table was declared.
     */
    record TableDef(int line, String name) implements SyntaxNode {
        public TableDef {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTable(this);
        }
    }

    /**
     * {@code @ALLOC name = count} (auto, {@code start == null}) or {@code @ALLOC name START=s COUNT=c}.
     */
    record Alloc(int line, String name, Expr start, Expr count) implements SyntaxNode {
        public Alloc {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(count, "count must not be null");
        }

        public boolean isAuto() {
            return start == null;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAlloc(this);
        }
    }

    /**
     * {@code @FOR i,row IN table}. {@code indexVar} is {@code null} for the {@code @FOR row IN table}
     * form.
     */
    record ForTable(int line, String indexVar, String rowVar, String table, List<SyntaxNode> body)
            implements SyntaxNode {
        public ForTable {
            Objects.requireNonNull(rowVar, "rowVar must not be null");
            Objects.requireNonNull(table, "table must not be null");
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitForTable(this);
        }
    }

    /** {@code @FOR i IN lo..hi}, half-open. */
    record ForRange(int line, String indexVar, Expr lo, Expr hi, List<SyntaxNode> body) implements SyntaxNode {
        public ForRange {
            Objects.requireNonNull(indexVar, "indexVar must not be null");
            Objects.requireNonNull(lo, "lo must not be null");
            Objects.requireNonNull(hi, "hi must not be null");
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitForRange(this);
        }
    }

    /** {@code @IF cond ... [@ELSE ...] @ENDIF}; {@code elseBody} is empty when there is no else. */
    record If(int line, Expr condition, List<SyntaxNode> thenBody, List<SyntaxNode> elseBody)
            implements SyntaxNode {
        public If {
            Objects.requireNonNull(condition, "condition must not be null");
            thenBody = List.copyOf(thenBody);
            elseBody = List.copyOf(elseBody);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIf(this);
        }
    }
}
