package io.procmacro.core.engine;

import io.procmacro.core.error.EvaluationException;
import io.procmacro.core.error.ExpansionLimitExceededException;
import io.procmacro.core.error.ExpressionTypeException;
import io.procmacro.core.error.NonDeterministicLoopException;
import io.procmacro.core.error.ProcedureCompileException;
import io.procmacro.core.error.UndefinedVariableException;
import io.procmacro.core.expr.Evaluator;
import io.procmacro.core.expr.Expr;
import io.procmacro.core.model.CompileError;
import io.procmacro.core.model.ExpandedStep;
import io.procmacro.core.model.ParsedProcedure;
import io.procmacro.core.model.StepRole;
import io.procmacro.core.model.StepTemplate;
import io.procmacro.core.model.SyntaxNode;
import io.procmacro.core.model.Table;
import io.procmacro.core.model.Value;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands a parsed procedure in one forward pass, in authored order, without backtracking.
 *
 * <p>Each node is expanded under a guard: a {@link ProcedureCompileException} is recorded as a
 * {@link CompileError} against the node's line, the node is skipped, and expansion continues with
 * the next node. Identical errors raised repeatedly (for example once per loop iteration) are
 * reported once; {@link CompileError} equality is the identity.
 * {@link ExpansionLimitExceededException} is fatal and ends the pass.
 *
 * <p>Block bodies run in a fresh scope frame; {@code @LET} inside a block is not visible after it.
 *
 * <p>Single use, not thread-safe: create one instance per compile.
 */
final class Expander implements SyntaxNode.Visitor<Void> {

    private static final Logger LOG = LoggerFactory.getLogger(Expander.class);

    private final ParsedProcedure parsed;
    private final CompileLimits limits;
    private final Allocator allocator = new Allocator();
    private final SymbolTable symbols;
    private final Evaluator evaluator;

    private final List<ExpandedStep> steps = new ArrayList<>();
    private final List<ExpansionResult.IdOwnership> ownership = new ArrayList<>();
    private final Set<CompileError> errors = new LinkedHashSet<>();
    private long iterations;
    private int blockDepth;
    private int currentLine;
    private boolean used;

    Expander(ParsedProcedure parsed, CompileLimits limits) {
        this.parsed = Objects.requireNonNull(parsed, "parsed must not be null");
        this.limits = Objects.requireNonNull(limits, "limits must not be null");
        this.symbols = new SymbolTable(allocator);
        this.evaluator = new Evaluator(symbols);
    }

    ExpansionResult expand() {
        if (used) {
            throw new IllegalStateException("Expander instances are single use");
        }
        used = true;
        boolean aborted = false;
        try {
            expandBody(parsed.nodes());
        } catch (ExpansionLimitExceededException e) {
            LOG.debug("procedure.expansion.aborted source={} line={} limit={}", parsed.source(), currentLine, e.limit());
            errors.add(CompileError.from(e, currentLine));
            aborted = true;
        }
        return new ExpansionResult(steps, allocator.allocations(), ownership, new ArrayList<>(errors), aborted);
    }

    // --- node visitors ---

    @Override
    public Void visitStep(SyntaxNode.Step node) {
        if (steps.size() >= limits.maxSteps()) {
            throw new ExpansionLimitExceededException("max-steps", limits.maxSteps());
        }
        StringBuilder text = new StringBuilder();
        Long produced = null;
        Set<String> owners = new LinkedHashSet<>();
        List<Long> references = new ArrayList<>();
        for (StepTemplate.Segment segment : node.template().segments()) {
            if (segment instanceof StepTemplate.Literal literal) {
                text.append(literal.text());
            } else if (segment instanceof StepTemplate.Substitution substitution) {
                text.append(evaluator.evaluate(substitution.expr()).render());
            } else if (segment instanceof StepTemplate.IdMarker marker) {
                long id = measurementId(marker);
                text.append(id);
                if (marker.leading()) {
                    produced = id;
                    owners.addAll(origins(marker.expr()));
                } else {
                    references.add(id);
                }
            }
        }
        StepRole role;
        Long measurementId;
        if (produced != null) {
            role = StepRole.ACTION;
            measurementId = produced;
            ownership.add(new ExpansionResult.IdOwnership(steps.size(), produced, node.line(), List.copyOf(owners)));
        } else if (!references.isEmpty()) {
            role = StepRole.EXPECTED;
            measurementId = references.get(0);
        } else {
            role = StepRole.TEXT;
            measurementId = null;
        }
        steps.add(new ExpandedStep(text.toString(), measurementId, role, references, node.line()));
        return null;
    }

    @Override
    public Void visitLet(SyntaxNode.LetBind node) {
        try {
            symbols.bind(node.name(), evaluator.evaluate(node.expr()), origins(node.expr()));
        } catch (ProcedureCompileException | SuppressedReferenceException e) {
            symbols.markFailed(node.name());
            throw e;
        }
        return null;
    }

    @Override
    public Void visitTable(SyntaxNode.TableDef node) {
        symbols.defineTable(parsed.tables().get(node.name()));
        return null;
    }

    @Override
    public Void visitAlloc(SyntaxNode.Alloc node) {
        try {
            long count = requireInt(evaluator.evaluate(node.count()), "@ALLOC COUNT");
            if (node.isAuto()) {
                allocator.allocateAuto(node.name(), count, node.line());
            } else {
                long start = requireInt(evaluator.evaluate(node.start()), "@ALLOC START");
                allocator.allocateManual(node.name(), start, count, node.line());
            }
        } catch (ProcedureCompileException | SuppressedReferenceException e) {
            if (allocator.find(node.name()).isEmpty()) {
                allocator.markFailed(node.name());
            }
            throw e;
        }
        allocator.find(node.name()).ifPresent(a -> LOG.debug(
                "procedure.allocation source={} name={} range={} auto={}",
                parsed.source(),
                a.name(),
                a.range(),
                a.auto()));
        return null;
    }

    @Override
    public Void visitForTable(SyntaxNode.ForTable node) {
        Table table = symbols.table(node.table())
                .orElseThrow(() -> new UndefinedVariableException(node.table(), "table"));
        reserveIterations(table.size());
        enterBlock();
        try {
            for (int i = 0; i < table.size(); i++) {
                symbols.push();
                try {
                    if (node.indexVar() != null) {
                        symbols.bind(node.indexVar(), Value.of((long) i));
                    }
                    symbols.bind(node.rowVar(), new Value.RowRef(table.name(), i, table.row(i)));
                    expandBody(node.body());
                } finally {
                    symbols.pop();
                }
            }
        } finally {
            blockDepth--;
        }
        return null;
    }

    @Override
    public Void visitForRange(SyntaxNode.ForRange node) {
        Value lo = evaluator.evaluate(node.lo());
        Value hi = evaluator.evaluate(node.hi());
        if (!(lo instanceof Value.Int from) || !(hi instanceof Value.Int to)) {
            throw new NonDeterministicLoopException(
                    node.indexVar(),
                    "range bounds must be integers, got " + lo.typeName() + ".." + hi.typeName());
        }
        if (from.value() > to.value()) {
            throw new EvaluationException("descending range " + from.value() + ".." + to.value());
        }
        long count;
        try {
            count = Math.subtractExact(to.value(), from.value());
        } catch (ArithmeticException e) {
            throw new EvaluationException("range " + from.value() + ".." + to.value() + " is too large");
        }
        Set<String> boundOrigins = new LinkedHashSet<>(origins(node.lo()));
        boundOrigins.addAll(origins(node.hi()));
        reserveIterations(count);
        enterBlock();
        try {
            for (long i = from.value(); i < to.value(); i++) {
                symbols.push();
                try {
                    symbols.bind(node.indexVar(), Value.of(i), boundOrigins);
                    expandBody(node.body());
                } finally {
                    symbols.pop();
                }
            }
        } finally {
            blockDepth--;
        }
        return null;
    }

    @Override
    public Void visitIf(SyntaxNode.If node) {
        Value condition = evaluator.evaluate(node.condition());
        if (!(condition instanceof Value.Bool bool)) {
            throw new ExpressionTypeException("@IF", List.of(condition.typeName()));
        }
        enterBlock();
        symbols.push();
        try {
            expandBody(bool.value() ? node.thenBody() : node.elseBody());
        } finally {
            symbols.pop();
            blockDepth--;
        }
        return null;
    }

    // --- helpers ---

    private void expandBody(List<SyntaxNode> body) {
        for (SyntaxNode node : body) {
            currentLine = node.line();
            try {
                node.accept(this);
            } catch (ExpansionLimitExceededException e) {
                throw e;
            } catch (ProcedureCompileException e) {
                errors.add(CompileError.from(e, node.line()));
            } catch (SuppressedReferenceException e) {
                LOG.debug("procedure.node.skipped source={} line={} failed_symbol={}", parsed.source(), node.line(), e.name());
            }
        }
    }

    private long measurementId(StepTemplate.IdMarker marker) {
        Value value = evaluator.evaluate(marker.expr());
        if (!(value instanceof Value.Int id)) {
            throw new ExpressionTypeException("{}", List.of(value.typeName()));
        }
        if (id.value() < 0) {
            throw new EvaluationException("measurement ID {" + marker.source() + "} is negative: " + id.value());
        }
        return id.value();
    }

    /** Allocations {@code expr} draws from, directly or through bindings; call after evaluating it. */
    private Set<String> origins(Expr expr) {
        Set<String> names = new LinkedHashSet<>();
        for (String symbol : Expr.symbols(expr)) {
            names.addAll(symbols.origins(symbol));
        }
        return names;
    }

    private static long requireInt(Value value, String operator) {
        if (value instanceof Value.Int i) {
            return i.value();
        }
        throw new ExpressionTypeException(operator, List.of(value.typeName()));
    }

    private void reserveIterations(long count) {
        if (count > limits.maxLoopIterations() - iterations) {
            throw new ExpansionLimitExceededException("max-loop-iterations", limits.maxLoopIterations());
        }
        iterations += count;
    }

    private void enterBlock() {
        if (blockDepth >= limits.maxNestingDepth()) {
            throw new ExpansionLimitExceededException("max-nesting-depth", limits.maxNestingDepth());
        }
        blockDepth++;
    }
}
