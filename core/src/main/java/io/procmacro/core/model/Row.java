package io.procmacro.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One {@code @ROW} of a table: column key to typed value, in authored column order. Rows of the same
 * table may have different key sets.
 */
public record Row(Map<String, Value> cells) {

    public Row {
        cells = Collections.unmodifiableMap(new LinkedHashMap<>(cells));
    }

    public Optional<Value> get(String key) {
        return Optional.ofNullable(cells.get(key));
    }

    public Set<String> keys() {
        return cells.keySet();
    }
}
