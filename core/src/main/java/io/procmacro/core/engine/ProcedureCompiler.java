package io.procmacro.core.engine;

import io.procmacro.core.error.DirectiveParseException;
import io.procmacro.core.model.CompileError;
import io.procmacro.core.model.CompileReport;
import io.procmacro.core.model.ExpandedProcedure;
import io.procmacro.core.model.ParsedProcedure;
import io.procmacro.core.parse.DirectiveParser;
import io.procmacro.core.spi.CompileListener;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles authored procedures: parse, expand, validate.
 *
 * <p>Parse errors are fatal and yield a report with exactly one error. Otherwise expansion and
 * validation errors are collected and reported together. A successful report carries the expanded
 * procedure, the allocation audit and the SHA-256 digest of the rendered text.
 *
 * <p>Thread-safe: each call owns its own expansion state, so one compiler may serve concurrent
 * compiles.
 */
public final class ProcedureCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(ProcedureCompiler.class);

    private final CompileLimits limits;
    private final CompileListener listener;
    private final DirectiveParser parser = new DirectiveParser();
    private final Validator validator = new Validator();

    /** Creates a compiler with {@link CompileLimits#DEFAULT} and no listener. */
    public ProcedureCompiler() {
        this(CompileLimits.DEFAULT, null);
    }

    public ProcedureCompiler(CompileLimits limits) {
        this(limits, null);
    }

    /**
     * @param limits   expansion limits
     * @param listener optional compile listener, may be {@code null}
     */
    public ProcedureCompiler(CompileLimits limits, CompileListener listener) {
        this.limits = Objects.requireNonNull(limits, "limits must not be null");
        this.listener = listener; // nullable
    }

    public CompileLimits limits() {
        return limits;
    }

    /** Compiles newline-separated authored text. */
    public CompileReport compile(String source, String text) {
        return compile(source, List.of(text.split("\n", -1)));
    }

    /**
     * Compiles authored lines.
     *
     * @param source display name used in logs, events and the report
     * @param lines  authored lines
     */
    public CompileReport compile(String source, List<String> lines) {
        long startNanos = System.nanoTime();

        ParsedProcedure parsed;
        try {
            parsed = parser.parse(source, lines);
        } catch (DirectiveParseException e) {
            return rejected(source, List.of(CompileError.from(e, e.line())), startNanos);
        }

        ExpansionResult draft = new Expander(parsed, limits).expand();
        List<CompileError> errors = new ArrayList<>(draft.errors());
        if (!draft.aborted()) {
            errors.addAll(validator.validate(draft));
        }
        if (!errors.isEmpty()) {
            return rejected(source, errors, startNanos);
        }

        ExpandedProcedure procedure = new ExpandedProcedure(draft.steps());
        String sha256 = sha256Hex(procedure.render());
        CompileReport report = CompileReport.success(source, procedure, draft.allocations(), sha256);
        long durationMs = elapsedMs(startNanos);
        LOG.info(
                "procedure.compiled source={} steps={} allocations={} duration_ms={} sha256={}",
                source,
                procedure.size(),
                report.allocations().size(),
                durationMs,
                sha256);
        notifySucceeded(report, durationMs);
        return report;
    }

    private CompileReport rejected(String source, List<CompileError> errors, long startNanos) {
        CompileReport report = CompileReport.failure(source, errors);
        long durationMs = elapsedMs(startNanos);
        LOG.warn(
                "procedure.rejected source={} errors={} duration_ms={} first={}",
                source,
                errors.size(),
                durationMs,
                errors.get(0));
        notifyFailed(report, durationMs);
        return report;
    }

    /** Lower-case hex SHA-256 of the UTF-8 bytes of {@code text}. */
    static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    // --- listener helpers ---

    private void notifySucceeded(CompileReport report, long durationMs) {
        if (listener == null) return;
        try {
            listener.onCompileSucceeded(new CompileListener.CompileSucceededEvent(
                    report.source(), report.procedure().size(), report.allocations(), report.sha256(), durationMs));
        } catch (Exception e) {
            LOG.warn("CompileListener.onCompileSucceeded failed", e);
        }
    }

    private void notifyFailed(CompileReport report, long durationMs) {
        if (listener == null) return;
        try {
            listener.onCompileFailed(
                    new CompileListener.CompileFailedEvent(report.source(), report.errors(), durationMs));
        } catch (Exception e) {
            LOG.warn("CompileListener.onCompileFailed failed", e);
        }
    }
}
