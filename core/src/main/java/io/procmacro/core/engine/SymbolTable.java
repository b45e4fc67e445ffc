package io.procmacro.core.engine;

import io.procmacro.core.error.ExpressionTypeException;
import io.procmacro.core.error.MissingRowKeyException;
import io.procmacro.core.error.UndefinedVariableException;
import io.procmacro.core.expr.EvaluationScope;
import io.procmacro.core.model.Allocation;
import io.procmacro.core.model.Table;
import io.procmacro.core.model.Value;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Lexically scoped bindings for one expansion: a stack of frames, the table store and the
 * allocator's names.
 *
 * <p>Lookup searches frames innermost first, then allocation names (which resolve to the range
 * start). A name whose definition failed in a frame shadows outer bindings and raises
 * {@link SuppressedReferenceException}.
 *
 * <p>Every binding remembers the allocations its value was computed from, so an ID reached through
 * {@code @LET} or a range variable still belongs to its allocation. Tables become visible when
 * expansion reaches their definition and stay visible for the rest of the pass.
 */
final class SymbolTable implements EvaluationScope {

    private final Deque<Frame> frames = new ArrayDeque<>();
    private final Map<String, Table> tables = new LinkedHashMap<>();
    private final Allocator allocator;

    SymbolTable(Allocator allocator) {
        this.allocator = Objects.requireNonNull(allocator, "allocator must not be null");
        frames.push(new Frame());
    }

    void push() {
        frames.push(new Frame());
    }

    void pop() {
        if (frames.size() == 1) {
            throw new IllegalStateException("cannot pop the global frame");
        }
        frames.pop();
    }

    /** Number of frames including the global one. */
    int depth() {
        return frames.size();
    }

    /** Binds (or rebinds) {@code name} in the innermost frame with no allocation origin. */
    void bind(String name, Value value) {
        bind(name, value, Set.of());
    }

    /**
     * Binds (or rebinds) {@code name} in the innermost frame.
     *
     * @param origins allocations the value was computed from
     */
    void bind(String name, Value value, Set<String> origins) {
        Frame frame = frames.peek();
        frame.failed.remove(name);
        frame.bindings.put(name, value);
        frame.origins.put(name, Collections.unmodifiableSet(new LinkedHashSet<>(origins)));
    }

    /** Records that the definition of {@code name} failed in the innermost frame. */
    void markFailed(String name) {
        Frame frame = frames.peek();
        frame.bindings.remove(name);
        frame.origins.remove(name);
        frame.failed.add(name);
    }

    /** Makes {@code table} visible from here on. Re-defining the same table is a no-op. */
    void defineTable(Table table) {
        tables.putIfAbsent(table.name(), table);
    }

    Optional<Table> table(String name) {
        return Optional.ofNullable(tables.get(name));
    }

    /**
     * Allocations the current value of {@code name} was computed from: the recorded origins of a
     * frame binding, the allocation itself for an unshadowed allocation name, empty otherwise.
     */
    Set<String> origins(String name) {
        for (Frame frame : frames) {
            if (frame.bindings.containsKey(name)) {
                return frame.origins.getOrDefault(name, Set.of());
            }
            if (frame.failed.contains(name)) {
                return Set.of();
            }
        }
        return allocator.find(name).isPresent() ? Set.of(name) : Set.of();
    }

    @Override
    public Value lookup(String name) {
        Optional<Value> bound = frameValue(name);
        if (bound.isPresent()) {
            return bound.get();
        }
        Optional<Allocation> allocation = allocator.find(name);
        if (allocation.isPresent()) {
            return Value.of(allocation.get().range().start());
        }
        if (allocator.isFailed(name)) {
            throw new SuppressedReferenceException(name);
        }
        throw new UndefinedVariableException(name);
    }

    @Override
    public Value lookupMember(String name, String member) {
        Optional<Value> bound = frameValue(name);
        if (bound.isPresent()) {
            Value value = bound.get();
            if (value instanceof Value.RowRef ref) {
                return ref.row()
                        .get(member)
                        .orElseThrow(() -> new MissingRowKeyException(ref.table(), ref.index(), member));
            }
            throw new ExpressionTypeException("." + member, List.of(value.typeName()));
        }
        Optional<Allocation> allocation = allocator.find(name);
        if (allocation.isPresent()) {
            return switch (member) {
                case "start" -> Value.of(allocation.get().range().start());
                case "count" -> Value.of(allocation.get().range().count());
                case "end" -> Value.of(allocation.get().range().end());
                default -> throw new UndefinedVariableException(name + "." + member, "allocation member");
            };
        }
        if (allocator.isFailed(name)) {
            throw new SuppressedReferenceException(name);
        }
        throw new UndefinedVariableException(name);
    }

    @Override
    public long rowCount(String table) {
        return table(table)
                .orElseThrow(() -> new UndefinedVariableException(table, "table"))
                .size();
    }

    /** Innermost binding of {@code name}; a failed definition found first raises suppression. */
    private Optional<Value> frameValue(String name) {
        for (Frame frame : frames) {
            Value value = frame.bindings.get(name);
            if (value != null) {
                return Optional.of(value);
            }
            if (frame.failed.contains(name)) {
                throw new SuppressedReferenceException(name);
            }
        }
        return Optional.empty();
    }

    private static final class Frame {
        final Map<String, Value> bindings = new LinkedHashMap<>();
        final Map<String, Set<String>> origins = new HashMap<>();
        final Set<String> failed = new HashSet<>();
    }
}
